package io.cronhttp.config;

import io.cronhttp.JobScheduler;
import io.cronhttp.internal.sqlite.SqliteSchemaInitializer;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the scheduler start/stop lifecycle with the Spring container lifecycle.
 * The schema, when enabled, is created before the scheduler reloads jobs.
 */
public class CronHttpLifecycle implements SmartLifecycle {
    private final JobScheduler scheduler;
    private final SqliteSchemaInitializer schemaInitializer;
    private volatile boolean running = false;

    public CronHttpLifecycle(JobScheduler scheduler, SqliteSchemaInitializer schemaInitializer) {
        this.scheduler = scheduler;
        this.schemaInitializer = schemaInitializer;
    }

    @Override
    public void start() {
        if (schemaInitializer != null) {
            schemaInitializer.initialize();
        }
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
