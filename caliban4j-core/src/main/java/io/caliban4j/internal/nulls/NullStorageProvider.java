package io.caliban4j.internal.nulls;

import io.caliban4j.Storage;
import io.caliban4j.StorageProvider;
import io.caliban4j.core.Result;

import java.time.Clock;

public class NullStorageProvider implements StorageProvider {

    private final Clock clock;

    public NullStorageProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean supports(String url) {
        return url != null && url.startsWith("null:");
    }

    @Override
    public Result<Storage> connect(String url) {
        return Result.ok(new NullStorage(clock));
    }
}
