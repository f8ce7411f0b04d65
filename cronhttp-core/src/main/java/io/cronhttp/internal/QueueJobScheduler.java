package io.cronhttp.internal;

import io.cronhttp.JobRunner;
import io.cronhttp.JobScheduler;
import io.cronhttp.core.Job;
import io.cronhttp.core.JobConfigurationException;
import io.cronhttp.core.JobDefinition;
import io.cronhttp.core.JobRunnerRegistry;
import io.cronhttp.core.JobStore;
import io.cronhttp.core.WorkQueue;
import io.cronhttp.utils.ScheduleParseException;
import io.cronhttp.utils.ScheduleParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link JobScheduler} driven by a {@link WorkQueue} consumed on one dedicated thread.
 *
 * <p>For every job taken from the queue the loop computes the next run time and hands the job to
 * its runner with the remaining delay. The loop never waits for a run: each run sleeps on the
 * runner's timer and puts the job back on the queue when it is done, which is how recurring jobs
 * keep going. Only {@link #stop()} ends the loop; a job that cannot be scheduled (bad schedule,
 * unknown type) is logged and retired from rotation.
 */
public class QueueJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(QueueJobScheduler.class);

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

    private final JobStore store;
    private final WorkQueue queue;
    private final JobRunnerRegistry registry;
    private final ZoneId zone;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private Thread loopThread;

    public QueueJobScheduler(JobStore store, WorkQueue queue, JobRunnerRegistry registry, ZoneId zone) {
        this(store, queue, registry, zone, Clock.systemUTC());
    }

    public QueueJobScheduler(JobStore store, WorkQueue queue, JobRunnerRegistry registry, ZoneId zone, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Job scheduler starting with zone={}", zone);

        loopThread = new Thread(this::loop);
        loopThread.setName("cronhttp.scheduler");
        loopThread.setDaemon(true);
        loopThread.start();
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Job scheduler stopping...");

        queue.stop();
        Thread t = loopThread;
        loopThread = null;
        if (t != null) {
            try {
                t.join(STOP_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                t.interrupt();
            }
        }

        queue.clear();
        log.info("Job scheduler stopped.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public boolean submit(Job job) {
        return queue.submit(job);
    }

    @Override
    public CompletableFuture<Job> register(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        if (definition.name() == null || definition.name().isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (definition.type() == null || definition.type().isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        ScheduleParser.parse(definition.schedule(), clock.instant(), zone);

        return store.findTypeId(definition.type())
                .thenCompose(typeId -> {
                    if (typeId.isEmpty()) {
                        throw new JobConfigurationException("Job type \"" + definition.type() + "\" does not exist.");
                    }
                    JobRunner runner = registry.getRequired(typeId.get());
                    if (!runner.typeName().equals(definition.type())) {
                        throw new JobConfigurationException("Job type \"" + definition.type() + "\" has id "
                                + typeId.get() + " but that id is handled by \"" + runner.typeName() + "\"");
                    }
                    return store.insert(definition, typeId.get(), clock.instant());
                })
                .thenApply(job -> {
                    log.info("Registered {} job {}", definition.type(), job.describe());
                    submit(job);
                    return job;
                });
    }

    private void loop() {
        reload();

        while (true) {
            Job job;
            try {
                job = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (job == null) {
                break;
            }

            try {
                dispatch(job);
            } catch (Exception e) {
                log.error("Job scheduler failed to dispatch job {} msg={}", job.describe(), e.getMessage(), e);
                queue.retire(job);
            }
        }
        log.debug("Job scheduler loop exited");
    }

    private void reload() {
        try {
            List<Job> jobs = store.findIncomplete().get();
            int submitted = 0;
            for (Job job : jobs) {
                if (queue.submit(job)) {
                    submitted++;
                }
            }
            log.info("Reloaded {} unfinished job(s) from storage", submitted);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("Failed to reload unfinished jobs msg={}", e.getCause().getMessage(), e.getCause());
        }
    }

    /**
     * Schedules one job taken from the queue.
     */
    void dispatch(Job job) {
        if (job.getLastRan() == null) {
            job.advanceLastRan(job.getDateCreated() != null ? job.getDateCreated() : clock.instant());
        }

        Instant nextRun;
        try {
            nextRun = ScheduleParser.parse(job.getSchedule(), job.getLastRan(), zone);
        } catch (ScheduleParseException e) {
            log.error("Job {} has an invalid schedule '{}' and is removed from the schedule",
                    job.describe(), job.getSchedule());
            queue.retire(job);
            return;
        }

        Optional<JobRunner> runner = registry.find(job.getTypeId());
        if (runner.isEmpty()) {
            log.error("Job {} has unknown type id {} and is removed from the schedule",
                    job.describe(), job.getTypeId());
            queue.retire(job);
            return;
        }

        Instant now = clock.instant();
        Duration delay;
        if (!nextRun.isAfter(now)) {
            log.info("Job {} is behind schedule! Running now!", job.describe());
            delay = Duration.ZERO;
        } else {
            delay = Duration.between(now, nextRun);
            log.info("Scheduling job {} to run in {} seconds", job.describe(),
                    String.format("%.2f", delay.toMillis() / 1000d));
        }

        runner.get().run(job, delay).whenComplete((v, err) -> {
            if (err != null) {
                log.error("Job {} run did not complete msg={}", job.describe(), err.getMessage(), err);
                queue.retire(job);
            }
        });
    }
}
