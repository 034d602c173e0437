package io.caliban4j.core;

import java.time.Instant;

/**
 * Subset of a Kubernetes batch Job status used to derive {@link GkeJobStatus}.
 *
 * @param active         number of running pods, nullable
 * @param succeeded      number of succeeded pods, nullable
 * @param completionTime completion time, null while the job is incomplete
 */
public record GkeJobInfo(
        Integer active,
        Integer succeeded,
        Instant completionTime
) {
}
