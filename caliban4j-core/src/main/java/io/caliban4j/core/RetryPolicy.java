package io.caliban4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry budget with capped exponential backoff.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(10));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Delay before the given retry (1-based): initial * 2^(attempt-1), capped.
     */
    public Duration backoff(int attempt) {
        int exp = Math.max(0, Math.min(attempt - 1, 20));
        long ms = Math.min(initialBackoff.toMillis() * (1L << exp), maxBackoff.toMillis());
        return Duration.ofMillis(ms);
    }
}
