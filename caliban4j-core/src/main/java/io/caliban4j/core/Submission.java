package io.caliban4j.core;

import java.util.Map;

/**
 * What a platform reports back for a single submission.
 *
 * @param spec    the payload that was submitted, persisted as a {@link JobSpec}
 * @param details opaque platform details stored on the run (job ids, cluster, ...)
 * @param status  initial status
 */
public record Submission(
        Map<String, Object> spec,
        Map<String, Object> details,
        PlatformJobStatus status
) {
    public Submission {
        spec = Copies.map(spec);
        details = Copies.map(details);
        status = status == null ? JobStatus.SUBMITTED : status;
    }
}
