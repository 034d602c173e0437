package io.caliban4j.internal.compute;

import io.caliban4j.RunStatusProvider;
import io.caliban4j.core.Platform;
import io.caliban4j.core.PlatformJobStatus;
import io.caliban4j.core.Result;
import io.caliban4j.core.Run;
import io.caliban4j.core.TestJobStatus;

import java.util.Objects;
import java.util.Random;

/**
 * Reports a uniformly random status on every poll, so runs eventually reach a terminal state.
 */
public class TestStatusProvider implements RunStatusProvider {

    private static final TestJobStatus[] STATES = TestJobStatus.values();

    private final Random random;

    public TestStatusProvider() {
        this(new Random());
    }

    public TestStatusProvider(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    @Override
    public Platform platform() {
        return Platform.TEST;
    }

    @Override
    public Result<PlatformJobStatus> poll(Run run) {
        return Result.ok(STATES[random.nextInt(STATES.length)]);
    }

    @Override
    public Result<Boolean> stop(Run run) {
        return Result.ok(true);
    }
}
