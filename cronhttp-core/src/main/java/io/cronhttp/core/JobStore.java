package io.cronhttp.core;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Job and job-result persistence used by the scheduler and the runners.
 */
public interface JobStore {

    CompletableFuture<List<Job>> findIncomplete();

    CompletableFuture<Optional<Job>> findByUserAndName(long userId, String name);

    CompletableFuture<Optional<Integer>> findTypeId(String typeName);

    /**
     * Inserts a new job row and reads it back.
     */
    CompletableFuture<Job> insert(JobDefinition definition, int typeId, Instant now);

    CompletableFuture<Void> updateLastRan(long jobId, Instant lastRan);

    CompletableFuture<Void> markDone(long jobId, Instant now);

    CompletableFuture<Void> recordRun(long jobId, String result, Instant now);

    /**
     * Most recent results first.
     */
    CompletableFuture<List<JobRun>> findRecentRuns(long jobId, int limit);
}
