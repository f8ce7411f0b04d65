package io.cronhttp.core;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Single serialized channel to the job database.
 *
 * <p>Implementations run every statement on one connection, one at a time, so concurrent callers
 * never interleave. Failures complete the returned future exceptionally; nothing is retried.
 */
public interface PersistenceGateway extends AutoCloseable {

    /**
     * Runs a parameterized statement.
     *
     * @return all result rows keyed by column label, or an empty list for statements without a result set
     */
    CompletableFuture<List<Map<String, Object>>> execute(String sql, Object... args);

    /**
     * Runs a batch of statements separated by {@code ;}.
     */
    CompletableFuture<Void> executeScript(String script);

    @Override
    void close();
}
