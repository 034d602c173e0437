package io.caliban4j.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed name of a history collection.
 */
public record CollectionKey<T extends HistoryObject>(String name, Class<T> type) {

    public static final CollectionKey<ContainerSpec> CONTAINER_SPECS =
            new CollectionKey<>("container_specs", ContainerSpec.class);
    public static final CollectionKey<ExperimentGroup> EXPERIMENT_GROUPS =
            new CollectionKey<>("experiment_groups", ExperimentGroup.class);
    public static final CollectionKey<Experiment> EXPERIMENTS =
            new CollectionKey<>("experiments", Experiment.class);
    public static final CollectionKey<JobSpec> JOB_SPECS =
            new CollectionKey<>("job_specs", JobSpec.class);
    public static final CollectionKey<Job> JOBS =
            new CollectionKey<>("jobs", Job.class);
    public static final CollectionKey<Run> RUNS =
            new CollectionKey<>("runs", Run.class);

    public CollectionKey {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static List<CollectionKey<?>> all() {
        return List.of(CONTAINER_SPECS, EXPERIMENT_GROUPS, EXPERIMENTS, JOB_SPECS, JOBS, RUNS);
    }

    public static Optional<CollectionKey<?>> byName(String name) {
        return all().stream().filter(k -> k.name().equals(name)).findFirst();
    }
}
