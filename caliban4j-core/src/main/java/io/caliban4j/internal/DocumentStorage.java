package io.caliban4j.internal;

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
import io.caliban4j.core.QueryOp;
import io.caliban4j.core.Run;
import io.caliban4j.core.StorageException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Storage over six named document collections.
 *
 * <p>Get-or-create looks up the entity by its dedup key before inserting, so inserts never
 * rely on upsert semantics. Every write goes through the journal of the active transaction;
 * writes outside a transaction commit immediately.
 */
public abstract class DocumentStorage extends AbstractStorage {

    protected final EntityCodec codec;
    private JournalTransaction active;

    protected DocumentStorage(EntityCodec codec, Clock clock) {
        super(clock);
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    protected abstract <T extends HistoryObject> AbstractHistoryCollection<T> historyCollection(CollectionKey<T> key);

    /**
     * Called after a transaction commits and after every auto-committed write.
     */
    protected void afterCommit() {
    }

    @Override
    public Optional<HistoryCollection<?>> collection(String name) {
        return CollectionKey.byName(name).map(key -> (HistoryCollection<?>) historyCollection(key));
    }

    @Override
    public <T extends HistoryObject> Optional<HistoryCollection<T>> collection(CollectionKey<T> key) {
        return Optional.of(historyCollection(key));
    }

    @Override
    public Transaction begin() {
        if (active != null) {
            throw new IllegalStateException("a transaction is already active");
        }
        active = new JournalTransaction(this::afterCommit, () -> active = null);
        return active;
    }

    @Override
    protected boolean inTransaction() {
        return active != null;
    }

    protected <T extends HistoryObject> T insert(CollectionKey<T> key, T entity) {
        AbstractHistoryCollection<T> collection = historyCollection(key);
        collection.insertDocument(entity.id(), collection.encode(entity));
        journal(() -> collection.deleteDocument(entity.id()));
        return entity;
    }

    protected <T extends HistoryObject> T replace(CollectionKey<T> key, T entity) {
        AbstractHistoryCollection<T> collection = historyCollection(key);
        Map<String, Object> previous = collection.findDocument(entity.id())
                .orElseThrow(() -> new StorageException("no " + key.name() + " with id " + entity.id()));
        collection.replaceDocument(entity.id(), collection.encode(entity));
        journal(() -> collection.replaceDocument(entity.id(), previous));
        return entity;
    }

    private void journal(Runnable inverse) {
        if (active != null) {
            active.record(inverse);
        } else {
            afterCommit();
        }
    }

    @Override
    public ExperimentGroup getOrCreateGroup(String name, String user) {
        Objects.requireNonNull(user, "user must not be null");
        String groupName = name == null || name.isBlank() ? Entities.defaultGroupName(user, now()) : name;
        return findGroup(groupName, user)
                .orElseGet(() -> insert(CollectionKey.EXPERIMENT_GROUPS, Entities.newGroup(groupName, user, now())));
    }

    @Override
    public ContainerSpec getOrCreateContainerSpec(Map<String, Object> spec, String user) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(user, "user must not be null");
        String key = Entities.containerSpecKey(user, spec);
        return findByUniqueKey(CollectionKey.CONTAINER_SPECS, key)
                .orElseGet(() -> insert(CollectionKey.CONTAINER_SPECS, Entities.newContainerSpec(spec, user, now())));
    }

    @Override
    public Experiment getOrCreateExperiment(ExperimentGroup group,
                                            ContainerSpec containerSpec,
                                            String command,
                                            List<String> args,
                                            Map<String, Object> kwargs,
                                            String user) {
        Objects.requireNonNull(group, "group must not be null");
        Objects.requireNonNull(containerSpec, "containerSpec must not be null");
        Experiment candidate = Entities.newExperiment(group, containerSpec, command, args, kwargs, user, now());
        return findByUniqueKey(CollectionKey.EXPERIMENTS, candidate.uniqueKey())
                .orElseGet(() -> insert(CollectionKey.EXPERIMENTS, candidate));
    }

    @Override
    public JobSpec getOrCreateJobSpec(Experiment experiment, Platform platform, Map<String, Object> spec) {
        Objects.requireNonNull(experiment, "experiment must not be null");
        Objects.requireNonNull(platform, "platform must not be null");
        String key = Entities.jobSpecKey(experiment, platform, spec);
        return findByUniqueKey(CollectionKey.JOB_SPECS, key)
                .orElseGet(() -> insert(CollectionKey.JOB_SPECS, Entities.newJobSpec(experiment, platform, spec, now())));
    }

    @Override
    public Job createJob(Experiment experiment, Map<String, Object> kwargs) {
        Objects.requireNonNull(experiment, "experiment must not be null");
        int index = jobs(experiment).size();
        return insert(CollectionKey.JOBS, Entities.newJob(experiment, kwargs, index, now()));
    }

    @Override
    public Run addRun(Job job, Platform platform, PlatformJobStatus status, JobSpec jobSpec, Map<String, Object> details) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(platform, "platform must not be null");
        return insert(CollectionKey.RUNS, Entities.newRun(job, platform, status, jobSpec, details, now()));
    }

    @Override
    public Run updateRun(Run run) {
        Objects.requireNonNull(run, "run must not be null");
        return replace(CollectionKey.RUNS, run);
    }

    @Override
    public <T extends HistoryObject> Optional<T> find(CollectionKey<T> key, String id) {
        return historyCollection(key).get(id);
    }

    @Override
    public Optional<ExperimentGroup> findGroup(String name, String user) {
        return historyCollection(CollectionKey.EXPERIMENT_GROUPS)
                .where("name", QueryOp.EQ, name)
                .where("user", QueryOp.EQ, user)
                .execute()
                .findFirst();
    }

    @Override
    public List<Experiment> experiments(ExperimentGroup group) {
        return children(CollectionKey.EXPERIMENTS, "xgroup", group.id());
    }

    @Override
    public List<Job> jobs(Experiment experiment) {
        return children(CollectionKey.JOBS, "experiment", experiment.id());
    }

    @Override
    public List<Run> runs(Job job) {
        return children(CollectionKey.RUNS, "job", job.id());
    }

    @Override
    public List<Job> recentJobs(String user, int max) {
        if (max <= 0) {
            throw new IllegalArgumentException("max must be > 0");
        }
        List<Job> jobs = children(CollectionKey.JOBS, "user", user);
        Collections.reverse(jobs);
        return jobs.size() > max ? new ArrayList<>(jobs.subList(0, max)) : jobs;
    }

    private <T extends HistoryObject> Optional<T> findByUniqueKey(CollectionKey<T> key, String uniqueKey) {
        return historyCollection(key)
                .where("uniqueKey", QueryOp.EQ, uniqueKey)
                .execute()
                .findFirst();
    }

    // Ties on timestamp only occur across store handles; id breaks them so the order never
    // depends on backend scan order.
    private <T extends HistoryObject> List<T> children(CollectionKey<T> key, String field, String id) {
        List<T> found = new ArrayList<>(historyCollection(key)
                .where(field, QueryOp.EQ, id)
                .execute()
                .toList());
        found.sort(Comparator.comparing(HistoryObject::timestamp).thenComparing(HistoryObject::id));
        return found;
    }
}
