package io.caliban4j.utils;

import io.caliban4j.core.ConnectError;
import io.caliban4j.core.Result;
import io.caliban4j.core.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetriesTest {

    private static final RetryPolicy NO_DELAY = new RetryPolicy(3, Duration.ZERO, Duration.ZERO);

    @Test
    void transientFailureShouldBeRetried() {
        AtomicInteger calls = new AtomicInteger();

        Result<String> result = Retries.call(NO_DELAY, "poll", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            return "RUNNING";
        }, e -> e instanceof IOException);

        assertEquals("RUNNING", result.orElse(null));
        assertEquals(3, calls.get());
    }

    @Test
    void retryBudgetShouldBeBounded() {
        AtomicInteger calls = new AtomicInteger();

        Result<String> result = Retries.retry(NO_DELAY, "poll", () -> {
            calls.incrementAndGet();
            return Result.err(ConnectError.retryable("unavailable", null));
        });

        assertFalse(result.isOk());
        assertEquals(3, calls.get());
    }

    @Test
    void permanentFailureShouldNotBeRetried() {
        AtomicInteger calls = new AtomicInteger();

        Result<String> result = Retries.call(NO_DELAY, "poll", () -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad request");
        }, e -> e instanceof IOException);

        assertFalse(result.isOk());
        assertFalse(result.error().orElseThrow().retryable());
        assertTrue(result.error().orElseThrow().message().contains("bad request"));
        assertEquals(1, calls.get());
    }

    @Test
    void backoffShouldDoubleUpToCap() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), Duration.ofMillis(300));

        assertEquals(Duration.ofMillis(100), policy.backoff(1));
        assertEquals(Duration.ofMillis(200), policy.backoff(2));
        assertEquals(Duration.ofMillis(300), policy.backoff(3));
    }
}
