package io.cronhttp.core;

/**
 * A job whose stored configuration cannot be executed: unknown job type, or a payload that does
 * not match what its runner expects.
 */
public class JobConfigurationException extends RuntimeException {

    public JobConfigurationException(String message) {
        super(message);
    }

    public JobConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
