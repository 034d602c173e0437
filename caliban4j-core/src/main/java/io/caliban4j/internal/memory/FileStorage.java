package io.caliban4j.internal.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import io.caliban4j.core.StorageException;
import io.caliban4j.internal.EntityCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Memory store persisted to a single JSON file.
 *
 * <p>The file is read once when opened and rewritten after every commit. Writes go to a
 * temporary sibling that is then moved over the target, so a crash leaves the last
 * committed snapshot in place.
 */
public class FileStorage extends MemoryStorage {
    private static final Logger log = LoggerFactory.getLogger(FileStorage.class);

    private static final TypeReference<Map<String, Map<String, Map<String, Object>>>> SNAPSHOT_TYPE =
            new TypeReference<>() {
            };

    private final Path path;

    public FileStorage(Path path, EntityCodec codec, Clock clock) throws IOException {
        super(codec, clock);
        this.path = Objects.requireNonNull(path, "path must not be null").toAbsolutePath();
        load();
    }

    public Path path() {
        return path;
    }

    private void load() throws IOException {
        if (!Files.exists(path)) {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            log.info("history file not found, starting empty path={}", path);
            return;
        }
        Map<String, Map<String, Map<String, Object>>> snapshot =
                codec.objectMapper().readValue(path.toFile(), SNAPSHOT_TYPE);
        int documents = 0;
        for (Map.Entry<String, Map<String, Map<String, Object>>> entry : snapshot.entrySet()) {
            MemoryCollection<?> collection = memoryCollections().get(entry.getKey());
            if (collection == null) {
                log.warn("ignoring unknown collection in history file name={} path={}", entry.getKey(), path);
                continue;
            }
            collection.load(entry.getValue());
            documents += entry.getValue().size();
        }
        log.info("history file loaded path={} documents={}", path, documents);
    }

    @Override
    protected void afterCommit() {
        Map<String, Map<String, Map<String, Object>>> snapshot = new LinkedHashMap<>();
        memoryCollections().forEach((name, collection) -> snapshot.put(name, collection.snapshot()));

        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            codec.objectMapper().writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("failed to write history file " + path, e);
        }
    }

    @Override
    public void close() {
        log.debug("history file closed path={}", path);
    }
}
