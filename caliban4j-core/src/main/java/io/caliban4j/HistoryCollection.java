package io.caliban4j;

import io.caliban4j.core.QueryOp;

import java.util.Optional;

/**
 * Named collection of history entities of one type.
 */
public interface HistoryCollection<T> {

    String name();

    Optional<T> get(String id);

    Query<T> where(String field, QueryOp op, Object value);
}
