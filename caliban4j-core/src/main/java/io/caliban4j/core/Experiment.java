package io.caliban4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One parameter point: a group, a container spec and fixed arguments.
 *
 * <p>Deduplicated on (xgroup, containerSpec, args, kwargs) through {@code uniqueKey}.
 */
public record Experiment(
        String id,
        String uniqueKey,
        String name,
        String xgroup,
        String containerSpec,
        String container,
        String command,
        List<String> args,
        Map<String, Object> kwargs,
        String user,
        Instant timestamp
) implements HistoryObject {

    public Experiment {
        args = Copies.list(args);
        kwargs = Copies.map(kwargs);
    }
}
