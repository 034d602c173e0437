package io.caliban4j.internal;

import io.caliban4j.ComputePlatform;
import io.caliban4j.Storage;
import io.caliban4j.SubmissionCallback;
import io.caliban4j.core.BatchResult;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.Experiment;
import io.caliban4j.core.Job;
import io.caliban4j.core.JobSpec;
import io.caliban4j.core.JobStatus;
import io.caliban4j.core.PlatformRegistry;
import io.caliban4j.core.Run;
import io.caliban4j.core.Submission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Submits jobs and records each attempt as a run.
 *
 * <p>A submission that throws or is declined still produces a run, with status FAILED, so a
 * batch never stops at the first bad job.
 */
public class RunManager {
    private static final Logger log = LoggerFactory.getLogger(RunManager.class);

    public static final String ERROR = "error";

    private final Storage storage;
    private final PlatformRegistry platforms;

    public RunManager(Storage storage, PlatformRegistry platforms) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.platforms = Objects.requireNonNull(platforms, "platforms must not be null");
    }

    /**
     * A job paired with the spec to replay, or with a null spec for a fresh submission.
     */
    public record PlannedJob(Job job, JobSpec spec) {
        public PlannedJob {
            Objects.requireNonNull(job, "job must not be null");
        }
    }

    public Run submit(Job job, ComputePlatform compute) {
        return attempt(new PlannedJob(job, null), compute, SubmissionCallback.NONE);
    }

    public BatchResult submitAll(List<Job> jobs, ComputePlatform compute, SubmissionCallback callback) {
        List<PlannedJob> planned = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            planned.add(new PlannedJob(job, null));
        }
        return submitPlanned(planned, compute, callback);
    }

    public BatchResult submitPlanned(List<PlannedJob> planned, ComputePlatform compute, SubmissionCallback callback) {
        Objects.requireNonNull(compute, "compute must not be null");
        SubmissionCallback cb = callback == null ? SubmissionCallback.NONE : callback;

        List<Run> runs = new ArrayList<>(planned.size());
        int failed = 0;
        for (PlannedJob p : planned) {
            Run run = attempt(p, compute, cb);
            runs.add(run);
            if (run.status() == JobStatus.FAILED) {
                failed++;
            }
        }
        int submitted = runs.size() - failed;
        log.info("submitted {} of {} jobs to {} failed={}", submitted, runs.size(), compute.name(), failed);
        return new BatchResult(runs.size(), submitted, failed, runs);
    }

    /**
     * Submits the run's job spec again as a new run of the same job. The given run is not
     * modified.
     */
    public Optional<Run> clone(Run run) {
        Objects.requireNonNull(run, "run must not be null");
        Optional<Job> job = storage.find(CollectionKey.JOBS, run.job());
        if (job.isEmpty()) {
            log.warn("cannot clone run={}, job {} not found", run.id(), run.job());
            return Optional.empty();
        }
        Optional<ComputePlatform> compute = platforms.find(run.platform());
        if (compute.isEmpty()) {
            log.warn("cannot clone run={}, no compute registered for platform={}", run.id(), run.platform());
            return Optional.empty();
        }
        JobSpec spec = run.jobSpec() == null
                ? null
                : storage.find(CollectionKey.JOB_SPECS, run.jobSpec()).orElse(null);
        return Optional.of(attempt(new PlannedJob(job.get(), spec), compute.get(), SubmissionCallback.NONE));
    }

    private Run attempt(PlannedJob planned, ComputePlatform compute, SubmissionCallback callback) {
        Job job = planned.job();
        Optional<Submission> submission;
        try {
            submission = planned.spec() == null ? compute.submit(job) : compute.submit(job, planned.spec());
        } catch (Exception e) {
            log.error("job submission failed job={} platform={} msg={}", job.name(), compute.platform(), e.getMessage(), e);
            Run run = failedRun(planned, compute, e.getMessage());
            callback.failed(job, run, e);
            return run;
        }

        if (submission.isEmpty()) {
            log.error("job submission declined job={} platform={}", job.name(), compute.platform());
            Run run = failedRun(planned, compute, "submission declined by " + compute.name());
            callback.failed(job, run, null);
            return run;
        }

        Submission s = submission.get();
        Experiment experiment = storage.find(CollectionKey.EXPERIMENTS, job.experiment())
                .orElseThrow(() -> new IllegalStateException("experiment not found for job " + job.id()));
        JobSpec spec = storage.getOrCreateJobSpec(experiment, compute.platform(), s.spec());
        Run run = storage.addRun(job, compute.platform(), s.status(), spec, s.details());
        log.debug("job submitted job={} platform={} run={}", job.name(), compute.platform(), run.id());
        callback.submitted(job, run);
        return run;
    }

    private Run failedRun(PlannedJob planned, ComputePlatform compute, String message) {
        return storage.addRun(planned.job(), compute.platform(), JobStatus.FAILED, planned.spec(),
                Map.of(ERROR, message == null ? "unknown error" : message));
    }
}
