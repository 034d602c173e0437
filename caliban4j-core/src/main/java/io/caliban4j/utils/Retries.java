package io.caliban4j.utils;

import io.caliban4j.core.ConnectError;
import io.caliban4j.core.Result;
import io.caliban4j.core.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry around remote calls, returning a {@link Result} instead of throwing.
 */
public final class Retries {
    private static final Logger log = LoggerFactory.getLogger(Retries.class);

    private Retries() {
    }

    /**
     * Runs {@code call}, retrying failures accepted by {@code retryable} until the policy's
     * attempt budget is spent.
     */
    public static <T> Result<T> call(RetryPolicy policy,
                                     String what,
                                     Callable<T> call,
                                     Predicate<Exception> retryable) {
        Objects.requireNonNull(call, "call must not be null");
        Objects.requireNonNull(retryable, "retryable must not be null");
        return retry(policy, what, () -> {
            try {
                return Result.ok(call.call());
            } catch (Exception e) {
                String msg = what + " failed: " + e.getMessage();
                return Result.err(retryable.test(e)
                        ? ConnectError.retryable(msg, e)
                        : ConnectError.permanent(msg, e));
            }
        });
    }

    /**
     * Repeats {@code attempt} while it returns a retryable error and budget remains.
     */
    public static <T> Result<T> retry(RetryPolicy policy, String what, Supplier<Result<T>> attempt) {
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        Result<T> result = attempt.get();
        for (int n = 1; n < policy.maxAttempts(); n++) {
            ConnectError error = result.error().orElse(null);
            if (error == null || !error.retryable()) {
                return result;
            }
            Duration delay = policy.backoff(n);
            log.warn("{} failed, retrying attempt={} of {} in {}ms msg={}",
                    what, n + 1, policy.maxAttempts(), delay.toMillis(), error.message());
            if (!sleep(delay)) {
                return Result.err(ConnectError.permanent(what + " interrupted", error.cause()));
            }
            result = attempt.get();
        }
        return result;
    }

    private static boolean sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
