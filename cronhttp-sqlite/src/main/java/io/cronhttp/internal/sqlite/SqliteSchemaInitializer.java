package io.cronhttp.internal.sqlite;

import io.cronhttp.core.PersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Creates the {@code job}, {@code job_result}, {@code job_type} and {@code user} tables when the
 * database has no tables at all. An existing schema is left untouched.
 */
public class SqliteSchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(SqliteSchemaInitializer.class);

    static final String SCHEMA_RESOURCE = "schema.sql";

    private final PersistenceGateway gateway;

    public SqliteSchemaInitializer(PersistenceGateway gateway) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
    }

    /**
     * Blocks until the schema exists.
     *
     * @return true if the schema was created by this call
     */
    public boolean initialize() {
        int tables = gateway.execute("SELECT name FROM sqlite_master WHERE type = 'table'").join().size();
        if (tables > 0) {
            log.debug("Job database already has {} table(s), skipping schema creation", tables);
            return false;
        }
        log.info("No tables found in job database. Generating schema..");
        gateway.executeScript(loadSchema()).join();
        log.info("Schema generated successfully.");
        return true;
    }

    static String loadSchema() {
        ClassPathResource resource = new ClassPathResource(SCHEMA_RESOURCE, SqliteSchemaInitializer.class);
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource.getPath(), e);
        }
    }
}
