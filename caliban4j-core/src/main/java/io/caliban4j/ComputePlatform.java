package io.caliban4j;

import io.caliban4j.core.Job;
import io.caliban4j.core.JobSpec;
import io.caliban4j.core.Platform;
import io.caliban4j.core.Submission;

import java.util.Optional;

/**
 * Submits jobs to a compute platform.
 */
public interface ComputePlatform {

    String name();

    Platform platform();

    /**
     * Submits a new job. Empty means the platform declined the job.
     */
    Optional<Submission> submit(Job job) throws Exception;

    /**
     * Submits a job using an already materialised spec, for clones and resubmissions.
     */
    Optional<Submission> submit(Job job, JobSpec spec) throws Exception;
}
