package io.cronhttp.core;

import io.cronhttp.utils.EpochSeconds;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * {@link JobStore} issuing plain SQL through a {@link PersistenceGateway}.
 *
 * <p>Timestamps are written as fractional epoch seconds; {@code done} as 0/1.
 */
public class SqlJobStore implements JobStore {

    private static final String JOB_COLUMNS =
            "id, user_id, name, type_id, data, schedule, done, last_ran, date_created, date_updated";

    private final PersistenceGateway gateway;

    public SqlJobStore(PersistenceGateway gateway) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
    }

    @Override
    public CompletableFuture<List<Job>> findIncomplete() {
        return gateway.execute("SELECT " + JOB_COLUMNS + " FROM job WHERE done = 0 ORDER BY id")
                .thenApply(rows -> rows.stream().map(SqlJobStore::toJob).collect(Collectors.toList()));
    }

    @Override
    public CompletableFuture<Optional<Job>> findByUserAndName(long userId, String name) {
        return gateway.execute("SELECT " + JOB_COLUMNS + " FROM job WHERE user_id = ? AND name = ?", userId, name)
                .thenApply(rows -> rows.stream().findFirst().map(SqlJobStore::toJob));
    }

    @Override
    public CompletableFuture<Optional<Integer>> findTypeId(String typeName) {
        return gateway.execute("SELECT id FROM job_type WHERE name = ?", typeName)
                .thenApply(rows -> rows.stream().findFirst().map(row -> asInt(row.get("id"))));
    }

    @Override
    public CompletableFuture<Job> insert(JobDefinition definition, int typeId, Instant now) {
        Objects.requireNonNull(definition, "definition must not be null");
        double ts = EpochSeconds.toDouble(now);
        return gateway.execute(
                        "INSERT INTO job (user_id, name, type_id, data, schedule, done, last_ran, date_created, date_updated) "
                                + "VALUES (?, ?, ?, ?, ?, 0, NULL, ?, ?)",
                        definition.userId(), definition.name(), typeId, definition.data(), definition.schedule(), ts, ts)
                .thenCompose(ignored -> findByUserAndName(definition.userId(), definition.name()))
                .thenApply(found -> found.orElseThrow(() -> new IllegalStateException(
                        "Inserted job could not be read back: " + definition.name())));
    }

    @Override
    public CompletableFuture<Void> updateLastRan(long jobId, Instant lastRan) {
        double ts = EpochSeconds.toDouble(lastRan);
        return gateway.execute(
                        "UPDATE job SET last_ran = CASE WHEN last_ran IS NULL OR last_ran < ? THEN ? ELSE last_ran END, "
                                + "date_updated = ? WHERE id = ?",
                        ts, ts, ts, jobId)
                .thenApply(rows -> null);
    }

    @Override
    public CompletableFuture<Void> markDone(long jobId, Instant now) {
        return gateway.execute("UPDATE job SET done = 1, date_updated = ? WHERE id = ?",
                        EpochSeconds.toDouble(now), jobId)
                .thenApply(rows -> null);
    }

    @Override
    public CompletableFuture<Void> recordRun(long jobId, String result, Instant now) {
        return gateway.execute("INSERT INTO job_result (job_id, result, date_created) VALUES (?, ?, ?)",
                        jobId, result, EpochSeconds.toDouble(now))
                .thenApply(rows -> null);
    }

    @Override
    public CompletableFuture<List<JobRun>> findRecentRuns(long jobId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        return gateway.execute(
                        "SELECT id, job_id, result, date_created FROM job_result WHERE job_id = ? ORDER BY id DESC LIMIT ?",
                        jobId, limit)
                .thenApply(rows -> rows.stream()
                        .map(row -> new JobRun(
                                asLong(row.get("id")),
                                asLong(row.get("job_id")),
                                (String) row.get("result"),
                                EpochSeconds.fromColumn(row.get("date_created"))))
                        .collect(Collectors.toList()));
    }

    static Job toJob(Map<String, Object> row) {
        return Job.builder()
                .id(asLong(row.get("id")))
                .userId(asLong(row.get("user_id")))
                .name((String) row.get("name"))
                .typeId(asInt(row.get("type_id")))
                .data((String) row.get("data"))
                .schedule((String) row.get("schedule"))
                .done(asBoolean(row.get("done")))
                .lastRan(EpochSeconds.fromColumn(row.get("last_ran")))
                .dateCreated(EpochSeconds.fromColumn(row.get("date_created")))
                .dateUpdated(EpochSeconds.fromColumn(row.get("date_updated")))
                .build();
    }

    private static Long asLong(Object value) {
        return value == null ? null : ((Number) value).longValue();
    }

    private static int asInt(Object value) {
        return value == null ? 0 : ((Number) value).intValue();
    }

    private static boolean asBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && ((Number) value).intValue() != 0;
    }
}
