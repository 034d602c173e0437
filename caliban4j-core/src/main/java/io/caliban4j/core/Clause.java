package io.caliban4j.core;

import java.lang.reflect.Array;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A single predicate over a record's dictionary form.
 *
 * <p>The field is a dot path into nested maps ({@code "kwargs.learning_rate"}). A missing
 * key anywhere along the path means the clause does not match.
 *
 * <p>Values are normalised the same way entities are stored: instants become epoch
 * milliseconds and enums become their names.
 */
public record Clause(
        String field,
        QueryOp op,
        Object value
) implements Predicate<Map<String, Object>> {

    public Clause {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(op, "op must not be null");
        if (field.isBlank()) {
            throw new IllegalArgumentException("field must not be blank");
        }
        value = normalize(value);
        if (op == QueryOp.IN && !(value instanceof List<?>) && !(value instanceof String)) {
            throw new IllegalArgumentException("IN requires a collection, array or string value, got: " + value);
        }
    }

    public static Clause of(String field, QueryOp op, Object value) {
        return new Clause(field, op, value);
    }

    /**
     * Returns the record when it satisfies this clause, otherwise empty.
     */
    public Optional<Map<String, Object>> apply(Map<String, Object> record) {
        return test(record) ? Optional.of(record) : Optional.empty();
    }

    @Override
    public boolean test(Map<String, Object> record) {
        if (record == null) {
            return false;
        }
        Object actual = lookup(record, field);
        return actual != null && op.matches(actual, value);
    }

    /**
     * Resolves a dot path through nested maps; null when any segment is missing.
     */
    public static Object lookup(Map<String, Object> record, String path) {
        Object current = record;
        for (String key : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(key)) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }

    public static Object normalize(Object value) {
        if (value instanceof Instant instant) {
            return instant.toEpochMilli();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Collection<?> c) {
            List<Object> out = new ArrayList<>(c.size());
            for (Object o : c) {
                out.add(normalize(o));
            }
            return Collections.unmodifiableList(out);
        }
        if (value != null && value.getClass().isArray()) {
            int n = Array.getLength(value);
            List<Object> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                out.add(normalize(Array.get(value, i)));
            }
            return Collections.unmodifiableList(out);
        }
        return value;
    }

    @Override
    public String toString() {
        return field + " " + op.symbol() + " " + value;
    }
}
