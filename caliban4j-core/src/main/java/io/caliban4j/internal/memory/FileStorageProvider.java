package io.caliban4j.internal.memory;

import io.caliban4j.Storage;
import io.caliban4j.StorageProvider;
import io.caliban4j.core.ConnectError;
import io.caliban4j.core.Result;
import io.caliban4j.internal.EntityCodec;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Opens {@code file:<path>} URLs. A leading {@code ~} is the user's home directory.
 */
public class FileStorageProvider implements StorageProvider {

    public static final String DEFAULT_URL = "file:~/.caliban4j/history.json";

    private final EntityCodec codec;
    private final Clock clock;

    public FileStorageProvider(EntityCodec codec, Clock clock) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public boolean supports(String url) {
        return url != null && url.startsWith("file:");
    }

    @Override
    public Result<Storage> connect(String url) {
        try {
            Path path = toPath(url);
            return Result.ok(new FileStorage(path, codec, clock));
        } catch (IOException | InvalidPathException e) {
            return Result.err(ConnectError.permanent("cannot open history file " + url + ": " + e.getMessage(), e));
        }
    }

    static Path toPath(String url) {
        String raw = url.startsWith("file://") ? url.substring("file://".length()) : url.substring("file:".length());
        if (raw.isBlank()) {
            throw new InvalidPathException(url, "empty path");
        }
        if (raw.equals("~") || raw.startsWith("~/")) {
            raw = System.getProperty("user.home") + raw.substring(1);
        }
        return Path.of(raw);
    }
}
