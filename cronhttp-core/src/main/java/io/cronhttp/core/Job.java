package io.cronhttp.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhttp.utils.ScheduleParser;

import java.time.Instant;
import java.util.Objects;

/**
 * In-memory view of one row of the {@code job} table.
 *
 * <p>A single instance per live job circulates between the work queue, the scheduler loop and the
 * runner; {@link #getLastRan()} and {@link #isDone()} are the only fields that change while it
 * does. Hand-offs go through the work queue, the fields are volatile for the timer threads.
 */
public class Job {

    private final Long id;
    private final Long userId;
    private final String name;
    private final int typeId;
    private final String data;
    private final String schedule;
    private final boolean runOnce;
    private final Instant dateCreated;
    private final Instant dateUpdated;

    private volatile boolean done;
    private volatile Instant lastRan;

    private Job(Builder b) {
        this.id = b.id;
        this.userId = b.userId;
        this.name = b.name;
        this.typeId = b.typeId;
        this.data = b.data;
        this.schedule = b.schedule;
        this.done = b.done;
        this.lastRan = b.lastRan;
        this.dateCreated = b.dateCreated;
        this.dateUpdated = b.dateUpdated;
        this.runOnce = ScheduleParser.isRunOnce(b.schedule);
    }

    public Long getId() {
        return id;
    }

    public Long getUserId() {
        return userId;
    }

    public String getName() {
        return name;
    }

    public int getTypeId() {
        return typeId;
    }

    /**
     * Raw JSON payload, interpreted by the runner registered for {@link #getTypeId()}.
     */
    public String getData() {
        return data;
    }

    public String getSchedule() {
        return schedule;
    }

    /**
     * True when the schedule starts with {@code "once"}; such a job is marked done after one run.
     */
    public boolean isRunOnce() {
        return runOnce;
    }

    public boolean isDone() {
        return done;
    }

    public void markDone() {
        this.done = true;
    }

    public Instant getLastRan() {
        return lastRan;
    }

    /**
     * Moves {@code lastRan} forward; an older instant is ignored.
     *
     * @return the resulting value
     */
    public Instant advanceLastRan(Instant ranAt) {
        Objects.requireNonNull(ranAt, "ranAt must not be null");
        Instant current = lastRan;
        if (current == null || ranAt.isAfter(current)) {
            lastRan = ranAt;
        }
        return lastRan;
    }

    public Instant getDateCreated() {
        return dateCreated;
    }

    public Instant getDateUpdated() {
        return dateUpdated;
    }

    /**
     * Decodes {@link #getData()} into the runner's payload type.
     *
     * @throws JobConfigurationException if the payload is missing or does not bind
     */
    public <T> T payload(ObjectMapper objectMapper, Class<T> payloadClass) {
        if (data == null || data.isBlank()) {
            throw new JobConfigurationException("Job " + describe() + " has no payload");
        }
        try {
            T payload = objectMapper.readValue(data, payloadClass);
            if (payload == null) {
                throw new JobConfigurationException("Job " + describe() + " has a null payload");
            }
            return payload;
        } catch (JsonProcessingException e) {
            throw new JobConfigurationException(
                    "Job " + describe() + " payload is not a valid " + payloadClass.getSimpleName(), e);
        }
    }

    /**
     * Short identifier for log lines.
     */
    public String describe() {
        return "\"" + name + "\" (id=" + id + ")";
    }

    @Override
    public String toString() {
        return "Job{id=" + id
                + ", name='" + name + '\''
                + ", typeId=" + typeId
                + ", schedule='" + schedule + '\''
                + ", done=" + done
                + ", lastRan=" + lastRan
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long id;
        private Long userId;
        private String name;
        private int typeId;
        private String data;
        private String schedule;
        private boolean done;
        private Instant lastRan;
        private Instant dateCreated;
        private Instant dateUpdated;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder userId(Long userId) {
            this.userId = userId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder typeId(int typeId) {
            this.typeId = typeId;
            return this;
        }

        public Builder data(String data) {
            this.data = data;
            return this;
        }

        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder done(boolean done) {
            this.done = done;
            return this;
        }

        public Builder lastRan(Instant lastRan) {
            this.lastRan = lastRan;
            return this;
        }

        public Builder dateCreated(Instant dateCreated) {
            this.dateCreated = dateCreated;
            return this;
        }

        public Builder dateUpdated(Instant dateUpdated) {
            this.dateUpdated = dateUpdated;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }
}
