package io.caliban4j.internal.memory;

import io.caliban4j.Query;
import io.caliban4j.core.Clause;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.HistoryObject;
import io.caliban4j.internal.AbstractHistoryCollection;
import io.caliban4j.internal.EntityCodec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Insertion-ordered map of documents keyed by id.
 */
public class MemoryCollection<T extends HistoryObject> extends AbstractHistoryCollection<T> {

    private final Map<String, Map<String, Object>> documents = new LinkedHashMap<>();

    public MemoryCollection(CollectionKey<T> key, EntityCodec codec) {
        super(key, codec);
    }

    @Override
    protected Query<T> newQuery(Clause first) {
        return new MemoryQuery<>(this, List.of(first), null);
    }

    @Override
    public synchronized Optional<Map<String, Object>> findDocument(String id) {
        return Optional.ofNullable(documents.get(id));
    }

    @Override
    public synchronized void insertDocument(String id, Map<String, Object> document) {
        if (documents.containsKey(id)) {
            throw new IllegalStateException("document already exists in " + name() + ": " + id);
        }
        documents.put(id, document);
    }

    @Override
    public synchronized void replaceDocument(String id, Map<String, Object> document) {
        documents.put(id, document);
    }

    @Override
    public synchronized void deleteDocument(String id) {
        documents.remove(id);
    }

    /**
     * Snapshot of the documents in insertion order.
     */
    synchronized Stream<Map<String, Object>> documents() {
        return new ArrayList<>(documents.values()).stream();
    }

    synchronized Map<String, Map<String, Object>> snapshot() {
        return new LinkedHashMap<>(documents);
    }

    synchronized void load(Map<String, Map<String, Object>> loaded) {
        documents.clear();
        documents.putAll(loaded);
    }
}
