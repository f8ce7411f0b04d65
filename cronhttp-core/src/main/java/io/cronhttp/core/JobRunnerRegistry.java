package io.cronhttp.core;

import io.cronhttp.JobRunner;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Static {@code type_id -> runner} table. Adding a job type means adding a runner bean.
 */
public class JobRunnerRegistry {

    private final Map<Integer, JobRunner> runnersByTypeId;

    public JobRunnerRegistry(List<? extends JobRunner> runners) {
        this.runnersByTypeId = runners.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobRunner::typeId,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobRunner for type id: " + a.typeId());
                        }
                ));
        runnersByTypeId.values().forEach(JobRunner::load);
    }

    public Optional<JobRunner> find(int typeId) {
        return Optional.ofNullable(runnersByTypeId.get(typeId));
    }

    public JobRunner getRequired(int typeId) {
        JobRunner runner = runnersByTypeId.get(typeId);
        if (runner == null) {
            throw new JobConfigurationException("No JobRunner registered for type id: " + typeId);
        }
        return runner;
    }
}
