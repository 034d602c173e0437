package io.caliban4j.core;

/**
 * Failure of a remote call.
 *
 * @param message   what failed
 * @param retryable true when another attempt may succeed (timeouts, 5xx, throttling)
 * @param cause     underlying exception, nullable
 */
public record ConnectError(
        String message,
        boolean retryable,
        Throwable cause
) {
    public static ConnectError retryable(String message, Throwable cause) {
        return new ConnectError(message, true, cause);
    }

    public static ConnectError permanent(String message, Throwable cause) {
        return new ConnectError(message, false, cause);
    }

    public static ConnectError permanent(String message) {
        return new ConnectError(message, false, null);
    }
}
