package io.cronhttp.core;

import java.time.Instant;

/**
 * One row of the append-only {@code job_result} table.
 *
 * @param result JSON blob, {@code {"code":..,"body":..}} or {@code {"code":0,"error":..}}
 */
public record JobRun(
        Long id,
        long jobId,
        String result,
        Instant dateCreated
) {
}
