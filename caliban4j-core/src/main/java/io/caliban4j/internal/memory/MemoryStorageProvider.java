package io.caliban4j.internal.memory;

import io.caliban4j.Storage;
import io.caliban4j.StorageProvider;
import io.caliban4j.core.Result;
import io.caliban4j.internal.EntityCodec;

import java.time.Clock;
import java.util.Objects;

public class MemoryStorageProvider implements StorageProvider {

    public static final String URL = "mem:";

    private final EntityCodec codec;
    private final Clock clock;

    public MemoryStorageProvider(EntityCodec codec, Clock clock) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public boolean supports(String url) {
        return url != null && (url.startsWith("mem:") || url.startsWith("memory:"));
    }

    @Override
    public Result<Storage> connect(String url) {
        return Result.ok(new MemoryStorage(codec, clock));
    }
}
