package io.caliban4j;

import io.caliban4j.core.BatchResult;
import io.caliban4j.core.Job;
import io.caliban4j.core.JobStatus;
import io.caliban4j.core.JobSummary;
import io.caliban4j.core.ResubmitRequest;
import io.caliban4j.core.ResubmitResult;
import io.caliban4j.core.Run;
import io.caliban4j.core.StopResult;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for submitting, inspecting, stopping and resubmitting jobs.
 */
public interface JobHistory {

    Storage storage();

    Run submit(Job job, ComputePlatform compute);

    BatchResult submitAll(List<Job> jobs, ComputePlatform compute, SubmissionCallback callback);

    /**
     * Re-runs a run's job spec as a new run. The original run is left unchanged.
     */
    Optional<Run> clone(Run run);

    JobStatus updateStatus(Run run);

    boolean stop(Run run);

    /**
     * @param xgroup  group name; null lists the user's most recent jobs
     * @param maxJobs jobs per experiment with a group, total without; null for the default
     */
    List<JobSummary> status(String xgroup, Integer maxJobs, String user);

    StopResult stop(String xgroup, Integer maxJobs, String user);

    ResubmitResult resubmit(ResubmitRequest request);
}
