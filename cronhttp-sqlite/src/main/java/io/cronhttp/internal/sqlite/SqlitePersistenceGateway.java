package io.cronhttp.internal.sqlite;

import io.cronhttp.core.PersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link PersistenceGateway} over one SQLite connection owned by one thread ({@code cronhttp.db}).
 *
 * <p>Every statement is queued on that thread, so callers on the scheduler, runner and HTTP threads
 * never share the connection concurrently. The connection runs in auto-commit mode.
 */
public class SqlitePersistenceGateway implements PersistenceGateway {
    private static final Logger log = LoggerFactory.getLogger(SqlitePersistenceGateway.class);

    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final ExecutorService executor;

    public SqlitePersistenceGateway(SingleConnectionDataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("cronhttp.db");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Opens a gateway on a JDBC url such as {@code jdbc:sqlite:cronhttp.db} or {@code jdbc:sqlite::memory:}.
     */
    public static SqlitePersistenceGateway open(String url) {
        Objects.requireNonNull(url, "url must not be null");
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(url, true);
        dataSource.setAutoCommit(true);
        log.info("Opening job database {}", url);
        return new SqlitePersistenceGateway(dataSource);
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> execute(String sql, Object... args) {
        Objects.requireNonNull(sql, "sql must not be null");
        Object[] params = args == null ? new Object[0] : args.clone();
        return submit(() -> {
            log.debug("SQL: {}", sql);
            return jdbcTemplate.execute(sql, (PreparedStatementCallback<List<Map<String, Object>>>) ps -> {
                new ArgumentPreparedStatementSetter(params).setValues(ps);
                if (!ps.execute()) {
                    return List.of();
                }
                try (ResultSet rs = ps.getResultSet()) {
                    return new RowMapperResultSetExtractor<>(new ColumnMapRowMapper()).extractData(rs);
                }
            });
        });
    }

    @Override
    public CompletableFuture<Void> executeScript(String script) {
        Objects.requireNonNull(script, "script must not be null");
        return submit(() -> {
            ResourceDatabasePopulator populator =
                    new ResourceDatabasePopulator(new ByteArrayResource(script.getBytes(StandardCharsets.UTF_8)));
            populator.execute(dataSource);
            return null;
        });
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Job database is closed", e));
        }
    }

    /**
     * Lets queued statements finish, then closes the connection.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Job database thread did not finish in time; closing connection anyway");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        dataSource.destroy();
        log.info("Job database closed");
    }
}
