package io.caliban4j.core;

/**
 * Training job states reported by Cloud AI Platform.
 */
public enum CaipJobStatus implements PlatformJobStatus {
    STATE_UNSPECIFIED(false, JobStatus.UNKNOWN),
    QUEUED(false, JobStatus.SUBMITTED),
    PREPARING(false, JobStatus.SUBMITTED),
    RUNNING(false, JobStatus.RUNNING),
    SUCCEEDED(true, JobStatus.SUCCEEDED),
    FAILED(true, JobStatus.FAILED),
    CANCELLING(false, JobStatus.RUNNING),
    CANCELLED(true, JobStatus.STOPPED);

    private final boolean terminal;
    private final JobStatus canonical;

    CaipJobStatus(boolean terminal, JobStatus canonical) {
        this.terminal = terminal;
        this.canonical = canonical;
    }

    @Override
    public boolean isTerminal() {
        return terminal;
    }

    @Override
    public JobStatus canonical() {
        return canonical;
    }

    /**
     * Vendor states outside the known set map to {@link #STATE_UNSPECIFIED}.
     */
    public static CaipJobStatus parse(String state) {
        if (state == null || state.isBlank()) {
            return STATE_UNSPECIFIED;
        }
        for (CaipJobStatus s : values()) {
            if (s.name().equalsIgnoreCase(state.trim())) {
                return s;
            }
        }
        return STATE_UNSPECIFIED;
    }
}
