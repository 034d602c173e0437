package io.caliban4j.internal;

import io.caliban4j.Query;
import io.caliban4j.core.Clause;
import io.caliban4j.core.QueryOp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public abstract class AbstractQuery<T> implements Query<T> {

    protected final List<Clause> clauses;
    protected final String orderField;
    protected final Direction direction;
    protected final Integer limit;

    protected AbstractQuery(List<Clause> clauses, String orderField, Direction direction, Integer limit) {
        Objects.requireNonNull(clauses, "clauses must not be null");
        if (clauses.isEmpty()) {
            throw new IllegalArgumentException("a query needs at least one clause");
        }
        this.clauses = Collections.unmodifiableList(new ArrayList<>(clauses));
        this.orderField = orderField;
        this.direction = direction;
        this.limit = limit;
    }

    protected abstract AbstractQuery<T> copy(List<Clause> clauses, String orderField, Direction direction, Integer limit);

    @Override
    public Query<T> where(String field, QueryOp op, Object value) {
        List<Clause> next = new ArrayList<>(clauses);
        next.add(Clause.of(field, op, value));
        return copy(next, orderField, direction, limit);
    }

    @Override
    public Query<T> orderBy(String field, Direction direction) {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        return copy(clauses, field, direction, limit);
    }

    @Override
    public Query<T> limit(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return copy(clauses, orderField, direction, count);
    }

    @Override
    public List<Clause> clauses() {
        return clauses;
    }

    protected static boolean matchesAll(List<Clause> clauses, Map<String, Object> document) {
        for (Clause clause : clauses) {
            if (!clause.test(document)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{clauses=" + clauses
                + (orderField == null ? "" : ", orderBy=" + orderField + " " + direction)
                + (limit == null ? "" : ", limit=" + limit) + "}";
    }
}
