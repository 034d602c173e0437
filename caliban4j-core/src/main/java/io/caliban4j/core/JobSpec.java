package io.caliban4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * Platform-specific submission payload for an experiment.
 */
public record JobSpec(
        String id,
        String uniqueKey,
        String experiment,
        Platform platform,
        Map<String, Object> spec,
        Instant timestamp
) implements HistoryObject {

    public JobSpec {
        spec = Copies.map(spec);
    }
}
