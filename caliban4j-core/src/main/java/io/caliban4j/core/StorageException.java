package io.caliban4j.core;

/**
 * Storage failure that cannot be degraded to a fallback.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
