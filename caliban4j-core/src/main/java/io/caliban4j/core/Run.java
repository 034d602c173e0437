package io.caliban4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * One execution attempt of a job on a platform.
 *
 * <p>{@code status} is the cached canonical status, {@code platformStatus} the native
 * value it was derived from, or null when the status was set directly. Terminality is
 * decided by the native value when there is one.
 */
public record Run(
        String id,
        String job,
        String jobSpec,
        String user,
        Platform platform,
        Instant timestamp,
        JobStatus status,
        String platformStatus,
        Map<String, Object> details
) implements HistoryObject {

    public Run {
        details = Copies.map(details);
    }

    public PlatformJobStatus typedStatus() {
        if (platformStatus == null || platform == null) {
            return status == null ? JobStatus.UNKNOWN : status;
        }
        return platform.parseStatus(platformStatus);
    }

    public boolean hasTerminalStatus() {
        return typedStatus().isTerminal();
    }

    public Run withStatus(PlatformJobStatus newStatus) {
        return new Run(id, job, jobSpec, user, platform, timestamp,
                newStatus.canonical(), nativeName(newStatus), details);
    }

    /**
     * Native name to persist next to the canonical status; null when the status is already
     * canonical, which makes the canonical value authoritative.
     */
    public static String nativeName(PlatformJobStatus status) {
        return status instanceof JobStatus ? null : status.name();
    }
}
