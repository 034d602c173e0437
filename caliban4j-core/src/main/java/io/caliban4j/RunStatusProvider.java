package io.caliban4j;

import io.caliban4j.core.Platform;
import io.caliban4j.core.PlatformJobStatus;
import io.caliban4j.core.Result;
import io.caliban4j.core.Run;

/**
 * Reads and stops runs on one platform.
 */
public interface RunStatusProvider {

    Platform platform();

    Result<PlatformJobStatus> poll(Run run);

    /**
     * Cancels or deletes the run remotely. {@code Ok(true)} means the platform accepted it.
     */
    Result<Boolean> stop(Run run);
}
