package io.caliban4j.internal.memory;

import io.caliban4j.Query;
import io.caliban4j.core.Clause;
import io.caliban4j.core.HistoryObject;
import io.caliban4j.internal.AbstractQuery;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Linear scan applying every clause, then the limit. Ordering is not supported.
 */
public class MemoryQuery<T extends HistoryObject> extends AbstractQuery<T> {

    private final MemoryCollection<T> collection;

    MemoryQuery(MemoryCollection<T> collection, List<Clause> clauses, Integer limit) {
        super(clauses, null, null, limit);
        this.collection = collection;
    }

    @Override
    protected AbstractQuery<T> copy(List<Clause> clauses, String orderField, Direction direction, Integer limit) {
        return new MemoryQuery<>(collection, clauses, limit);
    }

    @Override
    public Query<T> orderBy(String field, Direction direction) {
        throw new UnsupportedOperationException("orderBy is not supported by the in-memory store");
    }

    @Override
    public Stream<T> execute() {
        Stream<Map<String, Object>> matches = collection.documents()
                .filter(doc -> matchesAll(clauses, doc));
        if (limit != null) {
            matches = matches.limit(limit);
        }
        return matches.map(collection::decode);
    }
}
