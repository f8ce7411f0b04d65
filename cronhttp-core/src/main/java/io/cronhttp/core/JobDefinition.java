package io.cronhttp.core;

/**
 * Input for registering a new job.
 *
 * @param userId   owner
 * @param name     unique per user
 * @param type     job type name as stored in {@code job_type.name} (e.g. "http")
 * @param data     JSON payload understood by the runner of that type
 * @param schedule schedule string
 */
public record JobDefinition(
        long userId,
        String name,
        String type,
        String data,
        String schedule
) {
}
