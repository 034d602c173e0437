package io.caliban4j.internal;

import io.caliban4j.ComputePlatform;
import io.caliban4j.ImageBuilder;
import io.caliban4j.JobHistory;
import io.caliban4j.Storage;
import io.caliban4j.SubmissionCallback;
import io.caliban4j.core.BatchResult;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.Experiment;
import io.caliban4j.core.ExperimentGroup;
import io.caliban4j.core.Job;
import io.caliban4j.core.JobStatus;
import io.caliban4j.core.JobSummary;
import io.caliban4j.core.PlatformRegistry;
import io.caliban4j.core.ResubmitRequest;
import io.caliban4j.core.ResubmitResult;
import io.caliban4j.core.Run;
import io.caliban4j.core.StopResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class DefaultJobHistory implements JobHistory {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobHistory.class);

    public static final int DEFAULT_MAX_JOBS = 8;
    public static final int DEFAULT_JOBS_PER_EXPERIMENT = 1;

    private final Storage storage;
    private final StatusReconciler reconciler;
    private final RunManager runManager;
    private final Resubmitter resubmitter;
    private final int defaultMaxJobs;

    public DefaultJobHistory(Storage storage,
                             PlatformRegistry platforms,
                             StatusReconciler reconciler,
                             ImageBuilder imageBuilder,
                             int defaultMaxJobs) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler must not be null");
        this.runManager = new RunManager(storage, platforms);
        this.resubmitter = new Resubmitter(storage, reconciler, runManager, platforms, imageBuilder);
        if (defaultMaxJobs <= 0) {
            throw new IllegalArgumentException("defaultMaxJobs must be > 0");
        }
        this.defaultMaxJobs = defaultMaxJobs;
    }

    @Override
    public Storage storage() {
        return storage;
    }

    @Override
    public Run submit(Job job, ComputePlatform compute) {
        return runManager.submit(job, compute);
    }

    @Override
    public BatchResult submitAll(List<Job> jobs, ComputePlatform compute, SubmissionCallback callback) {
        return runManager.submitAll(jobs, compute, callback);
    }

    @Override
    public Optional<Run> clone(Run run) {
        return runManager.clone(run);
    }

    @Override
    public JobStatus updateStatus(Run run) {
        return reconciler.update(run);
    }

    @Override
    public boolean stop(Run run) {
        return reconciler.stop(run);
    }

    @Override
    public List<JobSummary> status(String xgroup, Integer maxJobs, String user) {
        List<JobSummary> summaries = select(xgroup, maxJobs, user);
        logSummaries(summaries);
        return summaries;
    }

    @Override
    public StopResult stop(String xgroup, Integer maxJobs, String user) {
        int attempted = 0;
        int stopped = 0;
        for (JobSummary summary : select(xgroup, maxJobs, user)) {
            if (summary.run() == null || summary.run().hasTerminalStatus()) {
                continue;
            }
            attempted++;
            if (reconciler.stop(summary.run())) {
                stopped++;
            }
        }
        log.info("stopped {} of {} active jobs failed={}", stopped, attempted, attempted - stopped);
        return new StopResult(attempted, stopped, attempted - stopped);
    }

    @Override
    public ResubmitResult resubmit(ResubmitRequest request) {
        return resubmitter.resubmit(request);
    }

    /**
     * With a group: the last {@code maxJobs} jobs (default 1) of every experiment in it.
     * Without: the user's {@code maxJobs} most recent jobs (default 8), oldest first.
     */
    private List<JobSummary> select(String xgroup, Integer maxJobs, String user) {
        Objects.requireNonNull(user, "user must not be null");
        if (maxJobs != null && maxJobs <= 0) {
            throw new IllegalArgumentException("maxJobs must be > 0");
        }
        List<JobSummary> summaries = new ArrayList<>();

        if (xgroup == null || xgroup.isBlank()) {
            List<Job> recent = new ArrayList<>(storage.recentJobs(user, maxJobs == null ? defaultMaxJobs : maxJobs));
            Collections.reverse(recent);
            for (Job job : recent) {
                Experiment experiment = storage.find(CollectionKey.EXPERIMENTS, job.experiment()).orElse(null);
                ExperimentGroup group = experiment == null
                        ? null
                        : storage.find(CollectionKey.EXPERIMENT_GROUPS, experiment.xgroup()).orElse(null);
                summaries.add(summarize(group, experiment, job));
            }
            return summaries;
        }

        Optional<ExperimentGroup> group = storage.findGroup(xgroup, user);
        if (group.isEmpty()) {
            log.info("no experiment group xgroup={} user={}", xgroup, user);
            return summaries;
        }
        int perExperiment = maxJobs == null ? DEFAULT_JOBS_PER_EXPERIMENT : maxJobs;
        for (Experiment experiment : storage.experiments(group.get())) {
            List<Job> jobs = storage.jobs(experiment);
            for (Job job : jobs.subList(Math.max(0, jobs.size() - perExperiment), jobs.size())) {
                summaries.add(summarize(group.get(), experiment, job));
            }
        }
        return summaries;
    }

    private JobSummary summarize(ExperimentGroup group, Experiment experiment, Job job) {
        Optional<Run> latest = storage.latestRun(job);
        if (latest.isEmpty()) {
            return new JobSummary(group, experiment, job, null, JobStatus.UNKNOWN);
        }
        Optional<Run> current = reconciler.refresh(latest.get());
        return new JobSummary(group, experiment, job,
                current.orElse(latest.get()),
                current.map(Run::status).orElse(JobStatus.UNKNOWN));
    }

    private void logSummaries(List<JobSummary> summaries) {
        String lastGroup = null;
        String lastExperiment = null;
        for (JobSummary s : summaries) {
            String groupName = s.group() == null ? "?" : s.group().name();
            if (!groupName.equals(lastGroup)) {
                log.info("xgroup {}", groupName);
                lastGroup = groupName;
                lastExperiment = null;
            }
            String experimentId = s.experiment() == null ? "?" : s.experiment().id();
            if (!experimentId.equals(lastExperiment)) {
                log.info("  experiment id={} container={} args={} kwargs={}", experimentId,
                        s.experiment() == null ? null : s.experiment().container(),
                        s.experiment() == null ? null : s.experiment().args(),
                        s.experiment() == null ? null : s.experiment().kwargs());
                lastExperiment = experimentId;
            }
            log.info("    job {} status={} platform={} kwargs={}", s.job().name(), s.status(),
                    s.run() == null ? null : s.run().platform(), s.job().kwargs());
        }
    }
}
