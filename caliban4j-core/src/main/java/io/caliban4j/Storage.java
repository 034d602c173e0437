package io.caliban4j;

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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for the experiment history hierarchy:
 * group, experiment, job, run, with container specs and job specs on the side.
 *
 * <p>Groups, container specs, experiments and job specs are created through
 * get-or-create on their dedup key, so the same inputs always yield the same entity.
 * Jobs and runs are append-only; a run's cached status is the only field updated in place.
 */
public interface Storage extends AutoCloseable {

    /**
     * Records an experiment for {@code container} and one job per config.
     *
     * <p>The group {@code name} and the container spec are created when missing. Calling this
     * again with the same inputs returns the same experiment and adds no jobs.
     *
     * @param name      experiment group name, generated when null
     * @param container image id the jobs run in
     * @param command   entrypoint, nullable
     * @param configs   expanded keyword-argument sets, one job each; empty means a single job
     * @param args      positional arguments shared by all jobs
     * @param user      owner
     */
    Experiment createExperiment(String name,
                                String container,
                                String command,
                                List<Map<String, Object>> configs,
                                List<String> args,
                                String user);

    /**
     * Expands sweep {@code configs} and records one experiment per parameter point, each with a
     * single job. Points that already exist in the group are returned as they are.
     *
     * @return the experiments in expansion order
     */
    List<Experiment> createExperiments(ExperimentGroup group,
                                       ContainerSpec containerSpec,
                                       String command,
                                       List<String> args,
                                       List<Map<String, Object>> configs,
                                       String user);

    Optional<HistoryCollection<?>> collection(String name);

    <T extends HistoryObject> Optional<HistoryCollection<T>> collection(CollectionKey<T> key);

    ExperimentGroup getOrCreateGroup(String name, String user);

    ContainerSpec getOrCreateContainerSpec(Map<String, Object> spec, String user);

    Experiment getOrCreateExperiment(ExperimentGroup group,
                                     ContainerSpec containerSpec,
                                     String command,
                                     List<String> args,
                                     Map<String, Object> kwargs,
                                     String user);

    JobSpec getOrCreateJobSpec(Experiment experiment, Platform platform, Map<String, Object> spec);

    Job createJob(Experiment experiment, Map<String, Object> kwargs);

    Run addRun(Job job, Platform platform, PlatformJobStatus status, JobSpec jobSpec, Map<String, Object> details);

    /**
     * Writes back a run's cached status.
     */
    Run updateRun(Run run);

    <T extends HistoryObject> Optional<T> find(CollectionKey<T> key, String id);

    Optional<ExperimentGroup> findGroup(String name, String user);

    List<Experiment> experiments(ExperimentGroup group);

    List<Job> jobs(Experiment experiment);

    List<Run> runs(Job job);

    default Optional<Run> latestRun(Job job) {
        List<Run> runs = runs(job);
        return runs.isEmpty() ? Optional.empty() : Optional.of(runs.get(runs.size() - 1));
    }

    /**
     * The user's most recent jobs across all groups, newest first.
     */
    List<Job> recentJobs(String user, int max);

    Transaction begin();

    @Override
    void close();
}
