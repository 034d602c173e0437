package io.caliban4j.core;

/**
 * A job with its reconciled status, as shown by status listings.
 *
 * @param run latest run of the job, null when it was never submitted
 */
public record JobSummary(
        ExperimentGroup group,
        Experiment experiment,
        Job job,
        Run run,
        JobStatus status
) {
}
