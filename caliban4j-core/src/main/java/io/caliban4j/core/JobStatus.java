package io.caliban4j.core;

/**
 * Cross-platform job status.
 *
 * <p>UNKNOWN means the status could not be confirmed; it is not terminal so the next
 * reconciliation polls again.
 */
public enum JobStatus implements PlatformJobStatus {
    SUBMITTED(false),
    RUNNING(false),
    SUCCEEDED(true),
    FAILED(true),
    STOPPED(true),
    UNKNOWN(false);

    private final boolean terminal;

    JobStatus(boolean terminal) {
        this.terminal = terminal;
    }

    @Override
    public boolean isTerminal() {
        return terminal;
    }

    @Override
    public JobStatus canonical() {
        return this;
    }

    public boolean isResubmittable() {
        return this == FAILED || this == STOPPED;
    }
}
