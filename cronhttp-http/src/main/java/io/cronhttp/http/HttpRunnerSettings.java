package io.cronhttp.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the HTTP client shared by all HTTP jobs.
 *
 * @param maxOpenRequests    cap on in-flight requests across all jobs; excess requests wait
 * @param connectTimeout     TCP connect timeout
 * @param readTimeout        socket read timeout
 * @param callTimeout        whole-call timeout, zero for none
 * @param maxIdleConnections idle keep-alive connections kept in the pool
 */
public record HttpRunnerSettings(
        int maxOpenRequests,
        Duration connectTimeout,
        Duration readTimeout,
        Duration callTimeout,
        int maxIdleConnections
) {

    public HttpRunnerSettings {
        if (maxOpenRequests <= 0) {
            throw new IllegalArgumentException("maxOpenRequests must be a positive number");
        }
        if (maxIdleConnections < 0) {
            throw new IllegalArgumentException("maxIdleConnections must not be negative");
        }
        Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        Objects.requireNonNull(readTimeout, "readTimeout must not be null");
        Objects.requireNonNull(callTimeout, "callTimeout must not be null");
    }

    public static HttpRunnerSettings defaults() {
        return new HttpRunnerSettings(200, Duration.ofSeconds(10), Duration.ofSeconds(30), Duration.ZERO, 5);
    }
}
