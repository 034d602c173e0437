package io.caliban4j.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a sequential batch submission. Failed items are recorded as FAILED runs.
 */
public record BatchResult(
        int total,
        int submitted,
        int failed,
        List<Run> runs
) {
    public BatchResult {
        runs = runs == null ? List.of() : List.copyOf(runs);
    }

    public static BatchResult empty() {
        return new BatchResult(0, 0, 0, List.of());
    }

    public BatchResult plus(BatchResult other) {
        List<Run> merged = new ArrayList<>(runs);
        merged.addAll(other.runs());
        return new BatchResult(total + other.total(), submitted + other.submitted(), failed + other.failed(), merged);
    }
}
