package io.caliban4j.internal.memory;

import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.HistoryObject;
import io.caliban4j.internal.AbstractHistoryCollection;
import io.caliban4j.internal.DocumentStorage;
import io.caliban4j.internal.EntityCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Process-local store. Contents are lost on close.
 */
public class MemoryStorage extends DocumentStorage {
    private static final Logger log = LoggerFactory.getLogger(MemoryStorage.class);

    private final Map<String, MemoryCollection<?>> collections = new LinkedHashMap<>();

    public MemoryStorage() {
        this(new EntityCodec(), Clock.systemUTC());
    }

    public MemoryStorage(EntityCodec codec, Clock clock) {
        super(codec, clock);
        for (CollectionKey<?> key : CollectionKey.all()) {
            collections.put(key.name(), newCollection(key));
        }
    }

    private <T extends HistoryObject> MemoryCollection<T> newCollection(CollectionKey<T> key) {
        return new MemoryCollection<>(key, codec);
    }

    @Override
    @SuppressWarnings("unchecked")
    protected <T extends HistoryObject> AbstractHistoryCollection<T> historyCollection(CollectionKey<T> key) {
        MemoryCollection<?> collection = collections.get(key.name());
        if (collection == null) {
            throw new IllegalArgumentException("unknown collection: " + key.name());
        }
        return (MemoryCollection<T>) collection;
    }

    protected Map<String, MemoryCollection<?>> memoryCollections() {
        return collections;
    }

    @Override
    public void close() {
        log.debug("in-memory history store closed");
    }
}
