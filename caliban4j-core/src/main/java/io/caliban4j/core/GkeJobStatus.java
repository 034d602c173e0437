package io.caliban4j.core;

/**
 * Job states for the Kubernetes Engine platform.
 */
public enum GkeJobStatus implements PlatformJobStatus {
    STATE_UNSPECIFIED(false, JobStatus.UNKNOWN),
    PENDING(false, JobStatus.SUBMITTED),
    RUNNING(false, JobStatus.RUNNING),
    FAILED(true, JobStatus.FAILED),
    SUCCEEDED(true, JobStatus.SUCCEEDED),
    UNAVAILABLE(true, JobStatus.UNKNOWN);

    private final boolean terminal;
    private final JobStatus canonical;

    GkeJobStatus(boolean terminal, JobStatus canonical) {
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
     * Derives the state from a job's pod counters.
     *
     * <p>A completed job succeeded if at least one pod succeeded. An incomplete job is
     * running while any pod is active and pending when none is. Kubernetes omits zero
     * counters, so a missing counter counts as zero.
     */
    public static GkeJobStatus fromJobInfo(GkeJobInfo info) {
        if (info == null) {
            return STATE_UNSPECIFIED;
        }
        if (info.completionTime() != null) {
            return count(info.succeeded()) > 0 ? SUCCEEDED : FAILED;
        }
        return count(info.active()) > 0 ? RUNNING : PENDING;
    }

    private static int count(Integer counter) {
        return counter == null ? 0 : counter;
    }
}
