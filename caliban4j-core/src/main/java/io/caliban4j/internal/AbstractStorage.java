package io.caliban4j.internal;

import io.caliban4j.Storage;
import io.caliban4j.Transaction;
import io.caliban4j.core.ContainerSpec;
import io.caliban4j.core.Experiment;
import io.caliban4j.core.ExperimentGroup;
import io.caliban4j.core.Job;
import io.caliban4j.utils.SweepExpander;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Experiment creation and transaction scoping shared by all backends.
 */
public abstract class AbstractStorage implements Storage {

    protected final Clock clock;
    private Instant lastIssued = Instant.MIN;

    protected AbstractStorage(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Creation time for a new record, in milliseconds. Strictly increasing per store handle, so
     * records written through one handle never tie on timestamp.
     */
    protected synchronized Instant now() {
        Instant instant = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        if (!instant.isAfter(lastIssued)) {
            instant = lastIssued.plusMillis(1);
        }
        lastIssued = instant;
        return instant;
    }

    @Override
    public Experiment createExperiment(String name,
                                       String container,
                                       String command,
                                       List<Map<String, Object>> configs,
                                       List<String> args,
                                       String user) {
        Objects.requireNonNull(container, "container must not be null");
        Objects.requireNonNull(user, "user must not be null");

        return inTransaction(() -> {
            ExperimentGroup group = getOrCreateGroup(name, user);
            Map<String, Object> spec = new LinkedHashMap<>();
            spec.put(ContainerSpec.IMAGE_ID, container);
            ContainerSpec containerSpec = getOrCreateContainerSpec(spec, user);
            Experiment experiment = getOrCreateExperiment(group, containerSpec, command, args, Map.of(), user);

            List<Map<String, Object>> points = configs == null || configs.isEmpty()
                    ? List.of(Map.of())
                    : configs;
            List<Job> existing = new ArrayList<>(jobs(experiment));
            for (Map<String, Object> point : points) {
                boolean present = existing.stream().anyMatch(j -> Entities.sameKwargs(j.kwargs(), point));
                if (!present) {
                    existing.add(createJob(experiment, point));
                }
            }
            return experiment;
        });
    }

    @Override
    public List<Experiment> createExperiments(ExperimentGroup group,
                                              ContainerSpec containerSpec,
                                              String command,
                                              List<String> args,
                                              List<Map<String, Object>> configs,
                                              String user) {
        Objects.requireNonNull(group, "group must not be null");
        Objects.requireNonNull(containerSpec, "containerSpec must not be null");
        Objects.requireNonNull(user, "user must not be null");

        List<Map<String, Object>> points = configs == null || configs.isEmpty()
                ? List.of(Map.of())
                : SweepExpander.expand(configs);
        return inTransaction(() -> {
            List<Experiment> experiments = new ArrayList<>(points.size());
            for (Map<String, Object> point : points) {
                Experiment experiment = getOrCreateExperiment(group, containerSpec, command, args, point, user);
                if (jobs(experiment).isEmpty()) {
                    createJob(experiment, Map.of());
                }
                experiments.add(experiment);
            }
            return experiments;
        });
    }

    /**
     * Runs {@code work} in the active transaction, or in a new one committed on success.
     */
    protected <T> T inTransaction(Supplier<T> work) {
        if (inTransaction()) {
            return work.get();
        }
        try (Transaction tx = begin()) {
            T result = work.get();
            tx.commit();
            return result;
        }
    }

    protected abstract boolean inTransaction();
}
