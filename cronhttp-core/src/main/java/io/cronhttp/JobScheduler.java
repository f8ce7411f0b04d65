package io.cronhttp;

import io.cronhttp.core.Job;
import io.cronhttp.core.JobDefinition;

import java.util.concurrent.CompletableFuture;

/**
 * Main scheduler API.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * scheduler.register(new JobDefinition(userId, "ping", "http",
 *         "{\"url\":\"https://example.org\",\"verb\":\"GET\",\"number_of_clones\":1,\"enable_shadows\":false}",
 *         "every 5 minutes")).join();
 *
 * scheduler.stop();
 * }</pre>
 */
public interface JobScheduler {

    /**
     * Reloads every unfinished job from storage and starts the dispatch loop. Idempotent.
     */
    void start();

    /**
     * Stops the dispatch loop. Runs already dispatched are not waited for. Idempotent.
     */
    void stop();

    boolean isRunning();

    /**
     * Puts an already persisted job into rotation.
     *
     * @return false if the job is done or already scheduled
     */
    boolean submit(Job job);

    /**
     * Validates the schedule and type, inserts the job row and submits the stored job.
     *
     * <p>If the type is missing from {@code job_type}, or no runner with that name is registered for its
     * id, the returned future completes exceptionally with a
     * {@link io.cronhttp.core.JobConfigurationException} and nothing is inserted.
     *
     * @throws io.cronhttp.utils.ScheduleParseException if the schedule is malformed
     */
    CompletableFuture<Job> register(JobDefinition definition);
}
