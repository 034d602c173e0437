package io.caliban4j.internal;

import io.caliban4j.HistoryCollection;
import io.caliban4j.Query;
import io.caliban4j.core.Clause;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.HistoryObject;
import io.caliban4j.core.QueryOp;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Collection backed by dictionary documents. Subclasses supply raw document access and
 * their query strategy.
 */
public abstract class AbstractHistoryCollection<T extends HistoryObject> implements HistoryCollection<T> {

    protected final CollectionKey<T> key;
    protected final EntityCodec codec;

    protected AbstractHistoryCollection(CollectionKey<T> key, EntityCodec codec) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public String name() {
        return key.name();
    }

    public CollectionKey<T> key() {
        return key;
    }

    @Override
    public Optional<T> get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return findDocument(id).map(this::decode);
    }

    @Override
    public Query<T> where(String field, QueryOp op, Object value) {
        return newQuery(Clause.of(field, op, value));
    }

    public T decode(Map<String, Object> document) {
        return codec.decode(document, key.type());
    }

    public Map<String, Object> encode(T entity) {
        return codec.encode(entity);
    }

    protected abstract Query<T> newQuery(Clause first);

    public abstract Optional<Map<String, Object>> findDocument(String id);

    /**
     * Adds a document; fails when the id is already present.
     */
    public abstract void insertDocument(String id, Map<String, Object> document);

    public abstract void replaceDocument(String id, Map<String, Object> document);

    public abstract void deleteDocument(String id);
}
