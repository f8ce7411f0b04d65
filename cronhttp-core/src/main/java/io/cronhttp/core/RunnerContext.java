package io.cronhttp.core;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Collaborators shared by every runner instance. Built once at startup and passed to each runner.
 *
 * @param store        job persistence
 * @param queue        scheduler work queue, used to hand jobs back after a run
 * @param objectMapper payload decoding and result encoding
 * @param executor     timer for run delays and thread for close-out steps
 * @param clock        time source
 */
public record RunnerContext(
        JobStore store,
        WorkQueue queue,
        ObjectMapper objectMapper,
        ScheduledExecutorService executor,
        Clock clock
) implements AutoCloseable {

    public RunnerContext {
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(queue, "queue must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Creates a context with its own single daemon thread named {@code cronhttp.runner}.
     */
    public static RunnerContext create(JobStore store, WorkQueue queue, ObjectMapper objectMapper, Clock clock) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("cronhttp.runner");
            t.setDaemon(true);
            return t;
        });
        return new RunnerContext(store, queue, objectMapper, executor, clock);
    }

    /**
     * Discards pending delayed runs.
     */
    @Override
    public void close() {
        executor.shutdownNow();
    }
}
