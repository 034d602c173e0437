package io.caliban4j.core;

import java.util.Map;

/**
 * @param candidates    jobs whose latest status qualified for resubmission
 * @param imagesBuilt   distinct container specs rebuilt
 * @param byPlatform    submission outcome per platform
 * @param failedPlatforms platforms whose batch aborted with an error
 */
public record ResubmitResult(
        int candidates,
        int imagesBuilt,
        Map<Platform, BatchResult> byPlatform,
        int failedPlatforms
) {
    public ResubmitResult {
        byPlatform = byPlatform == null ? Map.of() : Map.copyOf(byPlatform);
    }

    public int submitted() {
        return byPlatform.values().stream().mapToInt(BatchResult::submitted).sum();
    }

    public int failed() {
        return byPlatform.values().stream().mapToInt(BatchResult::failed).sum();
    }
}
