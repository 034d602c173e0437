package io.caliban4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single submission intent under an experiment. Jobs are append-only.
 */
public record Job(
        String id,
        String name,
        String experiment,
        String user,
        Instant timestamp,
        List<String> args,
        Map<String, Object> kwargs
) implements HistoryObject {

    public Job {
        args = Copies.list(args);
        kwargs = Copies.map(kwargs);
    }
}
