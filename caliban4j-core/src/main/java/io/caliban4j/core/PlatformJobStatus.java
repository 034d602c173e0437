package io.caliban4j.core;

/**
 * Status reported by a specific compute platform.
 *
 * <p>Every platform has its own vocabulary. Each value knows whether it is terminal
 * and how it maps onto the cross-platform {@link JobStatus}.
 */
public interface PlatformJobStatus {
    String name();

    boolean isTerminal();

    JobStatus canonical();
}
