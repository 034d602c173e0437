package io.caliban4j.core;

import java.time.Instant;

/**
 * Named collection of experiments owned by one user.
 */
public record ExperimentGroup(
        String id,
        String name,
        String user,
        Instant timestamp
) implements HistoryObject {
}
