package io.caliban4j.internal.nulls;

import io.caliban4j.HistoryCollection;
import io.caliban4j.Transaction;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.ContainerSpec;
import io.caliban4j.core.Experiment;
import io.caliban4j.core.ExperimentGroup;
import io.caliban4j.core.HistoryObject;
import io.caliban4j.core.Job;
import io.caliban4j.core.JobSpec;
import io.caliban4j.core.Platform;
import io.caliban4j.core.PlatformJobStatus;
import io.caliban4j.core.Run;
import io.caliban4j.internal.AbstractStorage;
import io.caliban4j.internal.Entities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Storage that persists nothing.
 *
 * <p>Entities live only as references inside their parent: experiments under their group,
 * jobs under their experiment, runs under their job. There are no collections to query,
 * and transactions have nothing to roll back.
 */
public class NullStorage extends AbstractStorage {
    private static final Logger log = LoggerFactory.getLogger(NullStorage.class);

    private final Map<String, HistoryObject> byId = new LinkedHashMap<>();
    private final Map<String, HistoryObject> byUniqueKey = new LinkedHashMap<>();
    private final Map<String, List<Experiment>> experimentsByGroup = new LinkedHashMap<>();
    private final Map<String, List<Job>> jobsByExperiment = new LinkedHashMap<>();
    private final Map<String, List<Run>> runsByJob = new LinkedHashMap<>();
    private boolean inTransaction;

    public NullStorage() {
        this(Clock.systemUTC());
    }

    public NullStorage(Clock clock) {
        super(clock);
    }

    @Override
    public Optional<HistoryCollection<?>> collection(String name) {
        return Optional.empty();
    }

    @Override
    public <T extends HistoryObject> Optional<HistoryCollection<T>> collection(CollectionKey<T> key) {
        return Optional.empty();
    }

    @Override
    public ExperimentGroup getOrCreateGroup(String name, String user) {
        Objects.requireNonNull(user, "user must not be null");
        String groupName = name == null || name.isBlank() ? Entities.defaultGroupName(user, now()) : name;
        return findGroup(groupName, user).orElseGet(() -> {
            ExperimentGroup group = Entities.newGroup(groupName, user, now());
            byId.put(group.id(), group);
            experimentsByGroup.put(group.id(), new ArrayList<>());
            return group;
        });
    }

    @Override
    public ContainerSpec getOrCreateContainerSpec(Map<String, Object> spec, String user) {
        Objects.requireNonNull(spec, "spec must not be null");
        return existing(Entities.containerSpecKey(user, spec), ContainerSpec.class)
                .orElseGet(() -> remember(Entities.newContainerSpec(spec, user, now()), ContainerSpec::uniqueKey));
    }

    @Override
    public Experiment getOrCreateExperiment(ExperimentGroup group, ContainerSpec containerSpec, String command,
                                            List<String> args, Map<String, Object> kwargs, String user) {
        Experiment candidate = Entities.newExperiment(group, containerSpec, command, args, kwargs, user, now());
        return existing(candidate.uniqueKey(), Experiment.class).orElseGet(() -> {
            remember(candidate, Experiment::uniqueKey);
            experimentsByGroup.computeIfAbsent(group.id(), k -> new ArrayList<>()).add(candidate);
            jobsByExperiment.put(candidate.id(), new ArrayList<>());
            return candidate;
        });
    }

    @Override
    public JobSpec getOrCreateJobSpec(Experiment experiment, Platform platform, Map<String, Object> spec) {
        return existing(Entities.jobSpecKey(experiment, platform, spec), JobSpec.class)
                .orElseGet(() -> remember(Entities.newJobSpec(experiment, platform, spec, now()), JobSpec::uniqueKey));
    }

    @Override
    public Job createJob(Experiment experiment, Map<String, Object> kwargs) {
        List<Job> jobs = jobsByExperiment.computeIfAbsent(experiment.id(), k -> new ArrayList<>());
        Job job = Entities.newJob(experiment, kwargs, jobs.size(), now());
        jobs.add(job);
        byId.put(job.id(), job);
        runsByJob.put(job.id(), new ArrayList<>());
        return job;
    }

    @Override
    public Run addRun(Job job, Platform platform, PlatformJobStatus status, JobSpec jobSpec, Map<String, Object> details) {
        Run run = Entities.newRun(job, platform, status, jobSpec, details, now());
        runsByJob.computeIfAbsent(job.id(), k -> new ArrayList<>()).add(run);
        byId.put(run.id(), run);
        return run;
    }

    @Override
    public Run updateRun(Run run) {
        List<Run> runs = runsByJob.getOrDefault(run.job(), List.of());
        for (int i = 0; i < runs.size(); i++) {
            if (runs.get(i).id().equals(run.id())) {
                runs.set(i, run);
                byId.put(run.id(), run);
                return run;
            }
        }
        throw new IllegalStateException("run is not attached to a job: " + run.id());
    }

    @Override
    public <T extends HistoryObject> Optional<T> find(CollectionKey<T> key, String id) {
        HistoryObject found = byId.get(id);
        return key.type().isInstance(found) ? Optional.of(key.type().cast(found)) : Optional.empty();
    }

    @Override
    public Optional<ExperimentGroup> findGroup(String name, String user) {
        return byId.values().stream()
                .filter(ExperimentGroup.class::isInstance)
                .map(ExperimentGroup.class::cast)
                .filter(g -> g.name().equals(name) && g.user().equals(user))
                .findFirst();
    }

    @Override
    public List<Experiment> experiments(ExperimentGroup group) {
        return copyOf(experimentsByGroup.get(group.id()));
    }

    @Override
    public List<Job> jobs(Experiment experiment) {
        return copyOf(jobsByExperiment.get(experiment.id()));
    }

    @Override
    public List<Run> runs(Job job) {
        return copyOf(runsByJob.get(job.id()));
    }

    @Override
    public List<Job> recentJobs(String user, int max) {
        List<Job> jobs = new ArrayList<>();
        jobsByExperiment.values().forEach(list -> list.stream().filter(j -> j.user().equals(user)).forEach(jobs::add));
        jobs.sort((a, b) -> b.timestamp().compareTo(a.timestamp()));
        return jobs.size() > max ? new ArrayList<>(jobs.subList(0, max)) : jobs;
    }

    @Override
    public Transaction begin() {
        if (inTransaction) {
            throw new IllegalStateException("a transaction is already active");
        }
        inTransaction = true;
        return new Transaction() {
            private boolean active = true;

            @Override
            public void commit() {
                end();
            }

            @Override
            public void rollback() {
                log.debug("rollback requested on null storage, nothing is persisted");
                end();
            }

            @Override
            public boolean isActive() {
                return active;
            }

            @Override
            public void close() {
                if (active) {
                    end();
                }
            }

            private void end() {
                if (!active) {
                    throw new IllegalStateException("transaction is no longer active");
                }
                active = false;
                inTransaction = false;
            }
        };
    }

    @Override
    protected boolean inTransaction() {
        return inTransaction;
    }

    @Override
    public void close() {
        log.debug("null storage closed entities={}", byId.size());
    }

    private <T extends HistoryObject> Optional<T> existing(String uniqueKey, Class<T> type) {
        HistoryObject found = byUniqueKey.get(uniqueKey);
        return type.isInstance(found) ? Optional.of(type.cast(found)) : Optional.empty();
    }

    private <T extends HistoryObject> T remember(T entity, Function<T, String> uniqueKey) {
        byId.put(entity.id(), entity);
        byUniqueKey.put(uniqueKey.apply(entity), entity);
        return entity;
    }

    private static <T> List<T> copyOf(List<T> source) {
        return source == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(source));
    }
}
