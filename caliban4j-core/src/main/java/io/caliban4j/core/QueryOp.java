package io.caliban4j.core;

import java.util.Collection;
import java.util.Objects;

/**
 * Comparison operators understood by every storage backend.
 *
 * <p>Ordering comparisons only match when both sides are numbers or both are strings.
 * Any other pairing is a non-match rather than an error.
 */
public enum QueryOp {
    LT("<") {
        @Override
        boolean matches(Object actual, Object expected) {
            Integer c = compare(actual, expected);
            return c != null && c < 0;
        }
    },
    LE("<=") {
        @Override
        boolean matches(Object actual, Object expected) {
            Integer c = compare(actual, expected);
            return c != null && c <= 0;
        }
    },
    GT(">") {
        @Override
        boolean matches(Object actual, Object expected) {
            Integer c = compare(actual, expected);
            return c != null && c > 0;
        }
    },
    GE(">=") {
        @Override
        boolean matches(Object actual, Object expected) {
            Integer c = compare(actual, expected);
            return c != null && c >= 0;
        }
    },
    EQ("==") {
        @Override
        boolean matches(Object actual, Object expected) {
            if (actual instanceof Number && expected instanceof Number) {
                Integer c = compare(actual, expected);
                return c != null && c == 0;
            }
            return Objects.equals(actual, expected);
        }
    },
    IN("in") {
        @Override
        boolean matches(Object actual, Object expected) {
            if (expected instanceof Collection<?> candidates) {
                for (Object candidate : candidates) {
                    if (EQ.matches(actual, candidate)) {
                        return true;
                    }
                }
                return false;
            }
            if (expected instanceof String s && actual instanceof String a) {
                return s.contains(a);
            }
            return false;
        }
    };

    private final String symbol;

    QueryOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    abstract boolean matches(Object actual, Object expected);

    private static Integer compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if (isIntegral(x) && isIntegral(y)) {
                return Long.compare(x.longValue(), y.longValue());
            }
            double dx = x.doubleValue();
            double dy = y.doubleValue();
            if (Double.isNaN(dx) || Double.isNaN(dy)) {
                return null;
            }
            return Double.compare(dx, dy);
        }
        if (a instanceof String x && b instanceof String y) {
            return x.compareTo(y);
        }
        return null;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }
}
