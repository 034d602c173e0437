package io.caliban4j.core;

/**
 * Local jobs run to completion before submission returns, so every state is terminal.
 */
public enum LocalJobStatus implements PlatformJobStatus {
    SUCCEEDED(JobStatus.SUCCEEDED),
    FAILED(JobStatus.FAILED),
    STOPPED(JobStatus.STOPPED);

    private final JobStatus canonical;

    LocalJobStatus(JobStatus canonical) {
        this.canonical = canonical;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public JobStatus canonical() {
        return canonical;
    }
}
