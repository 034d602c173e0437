package io.caliban4j.internal.compute;

import io.caliban4j.RunStatusProvider;
import io.caliban4j.core.Platform;
import io.caliban4j.core.PlatformJobStatus;
import io.caliban4j.core.Result;
import io.caliban4j.core.Run;

/**
 * Local jobs have finished by the time they are recorded; nothing to poll or stop.
 */
public class LocalStatusProvider implements RunStatusProvider {

    @Override
    public Platform platform() {
        return Platform.LOCAL;
    }

    @Override
    public Result<PlatformJobStatus> poll(Run run) {
        return Result.ok(run.typedStatus());
    }

    @Override
    public Result<Boolean> stop(Run run) {
        return Result.ok(true);
    }
}
