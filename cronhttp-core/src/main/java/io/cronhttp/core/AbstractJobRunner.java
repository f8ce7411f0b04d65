package io.cronhttp.core;

import io.cronhttp.JobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Base class for runners: delay, payload decoding and the close-out step shared by all job types.
 *
 * <p>A run goes through:
 * <ol>
 *   <li>wait for the delay on the context timer (no thread is blocked)</li>
 *   <li>decode the payload into {@link #payloadClass()} and {@link #validate} it</li>
 *   <li>{@link #execute} the work; the returned future decides when the run counts as finished</li>
 *   <li>close out once: advance and persist {@code last_ran}, then requeue the job or mark it done</li>
 * </ol>
 * A payload that cannot be decoded takes the job out of rotation without closing out. A job that left
 * rotation during the delay (scheduler restarted, queue cleared) is skipped.
 */
public abstract class AbstractJobRunner<T> implements JobRunner {
    private static final Logger log = LoggerFactory.getLogger(AbstractJobRunner.class);

    protected final RunnerContext context;

    protected AbstractJobRunner(RunnerContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    protected abstract Class<T> payloadClass();

    /**
     * Rejects payloads that decoded but cannot be executed.
     *
     * @throws JobConfigurationException if the payload is unusable
     */
    protected void validate(Job job, T payload) {
    }

    /**
     * Performs the unit of work. Close-out happens when the returned future completes.
     */
    protected abstract CompletableFuture<Void> execute(Job job, T payload);

    @Override
    public final CompletableFuture<Void> run(Job job, Duration delay) {
        Objects.requireNonNull(job, "job must not be null");
        return after(delay).thenComposeAsync(ignored -> start(job), context.executor());
    }

    private CompletableFuture<Void> after(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> elapsed = new CompletableFuture<>();
        context.executor().schedule(() -> elapsed.complete(null), delay.toNanos(), TimeUnit.NANOSECONDS);
        return elapsed;
    }

    private CompletableFuture<Void> start(Job job) {
        if (!context.queue().isCurrent(job)) {
            log.debug("Job {} was taken out of rotation while waiting; skipping run", job.describe());
            return CompletableFuture.completedFuture(null);
        }
        T payload;
        try {
            payload = job.payload(context.objectMapper(), payloadClass());
            validate(job, payload);
        } catch (JobConfigurationException e) {
            log.error("Job {} cannot run and is removed from the schedule: {}", job.describe(), e.getMessage(), e);
            context.queue().retire(job);
            return CompletableFuture.completedFuture(null);
        }

        log.debug("Job {} started", job.describe());
        CompletableFuture<Void> work;
        try {
            work = execute(job, payload);
        } catch (RuntimeException e) {
            work = CompletableFuture.failedFuture(e);
        }

        return work
                .handle((v, err) -> {
                    if (err != null) {
                        log.error("Job {} run failed msg={}", job.describe(), err.getMessage(), err);
                    }
                    return null;
                })
                .thenComposeAsync(ignored -> closeOut(job), context.executor());
    }

    private CompletableFuture<Void> closeOut(Job job) {
        Instant ranAt = job.advanceLastRan(context.clock().instant());
        return context.store().updateLastRan(job.getId(), ranAt)
                .handle((v, err) -> {
                    if (err != null) {
                        log.error("Failed to persist last_ran for job {} msg={}", job.describe(), err.getMessage(), err);
                    }
                    return null;
                })
                .thenCompose(ignored -> {
                    if (!job.isRunOnce()) {
                        context.queue().requeue(job);
                        log.debug("Job {} finished; rescheduling", job.describe());
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    job.markDone();
                    context.queue().retire(job);
                    log.info("One-shot job {} finished; marking done", job.describe());
                    return context.store().markDone(job.getId(), context.clock().instant())
                            .exceptionally(err -> {
                                log.error("Failed to mark job {} done msg={}", job.describe(), err.getMessage(), err);
                                return null;
                            });
                });
    }
}
