package io.caliban4j.core;

/**
 * States produced by the in-process test platform.
 */
public enum TestJobStatus implements PlatformJobStatus {
    SUBMITTED(JobStatus.SUBMITTED),
    RUNNING(JobStatus.RUNNING),
    SUCCEEDED(JobStatus.SUCCEEDED),
    FAILED(JobStatus.FAILED),
    STOPPED(JobStatus.STOPPED);

    private final JobStatus canonical;

    TestJobStatus(JobStatus canonical) {
        this.canonical = canonical;
    }

    @Override
    public boolean isTerminal() {
        return canonical.isTerminal();
    }

    @Override
    public JobStatus canonical() {
        return canonical;
    }
}
