package io.cronhttp.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the job scheduler.
 */
@ConfigurationProperties(prefix = "cronhttp")
public class CronHttpProperties {
    private boolean enabled = true;
    private String databaseUrl = "jdbc:sqlite:cronhttp.db";
    private String zone = "America/Chicago"; // all "day" schedules are computed in this zone
    private boolean initializeSchema = true;
    private final Http http = new Http();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public void setDatabaseUrl(String databaseUrl) {
        this.databaseUrl = databaseUrl;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Http getHttp() {
        return http;
    }

    /**
     * Settings of the shared HTTP client used by {@code http} jobs.
     */
    public static class Http {
        private int maxOpenRequests = 200; // global, across all jobs
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private Duration callTimeout = Duration.ZERO;
        private int maxIdleConnections = 5;

        public int getMaxOpenRequests() {
            return maxOpenRequests;
        }

        public void setMaxOpenRequests(int maxOpenRequests) {
            this.maxOpenRequests = maxOpenRequests;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }

        public int getMaxIdleConnections() {
            return maxIdleConnections;
        }

        public void setMaxIdleConnections(int maxIdleConnections) {
            this.maxIdleConnections = maxIdleConnections;
        }
    }
}
