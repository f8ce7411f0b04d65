package io.cronhttp;

import io.cronhttp.core.Job;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Executes the work of one job type. Exactly one runner instance is registered per type id.
 */
public interface JobRunner {

    /**
     * Value of {@code job.type_id} handled by this runner.
     */
    int typeId();

    /**
     * Value of {@code job_type.name} for {@link #typeId()}.
     */
    String typeName();

    /**
     * Per-instance setup, called once before the first run.
     */
    default void load() {
    }

    /**
     * Runs the job after {@code delay}, records the results, updates the job's bookkeeping and hands it
     * back to the scheduler unless it was a one-shot job.
     *
     * @return completes once the run has been closed out
     */
    CompletableFuture<Void> run(Job job, Duration delay);
}
