package io.caliban4j;

import io.caliban4j.core.Clause;
import io.caliban4j.core.QueryOp;

import java.util.List;
import java.util.stream.Stream;

/**
 * Immutable query over a history collection.
 *
 * <p>{@link #where}, {@link #orderBy} and {@link #limit} return a new query and never modify
 * the receiver, so a partially built query can be reused as a base.
 */
public interface Query<T> {

    enum Direction {
        ASCENDING,
        DESCENDING
    }

    Query<T> where(String field, QueryOp op, Object value);

    Query<T> orderBy(String field, Direction direction);

    /**
     * @throws IllegalArgumentException when {@code count <= 0}
     */
    Query<T> limit(int count);

    /**
     * Runs the query. The returned stream is lazy and can be consumed once; call
     * {@code execute()} again to re-run.
     */
    Stream<T> execute();

    List<Clause> clauses();
}
