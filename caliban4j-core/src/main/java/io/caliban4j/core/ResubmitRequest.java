package io.caliban4j.core;

import java.util.Objects;

/**
 * Parameters for resubmitting jobs.
 *
 * <p>With an {@code xgroup}, the newest job of every experiment in the group is a candidate.
 * Without one, the user's {@code maxJobs} most recent jobs are candidates. Unless
 * {@code allJobs} is set, only FAILED and STOPPED jobs are resubmitted.
 */
public final class ResubmitRequest {

    private final String xgroup;
    private final String user;
    private final boolean allJobs;
    private final int maxJobs;
    private final boolean dryRun;

    private ResubmitRequest(Builder b) {
        this.xgroup = (b.xgroup == null || b.xgroup.isBlank()) ? null : b.xgroup;
        this.user = Objects.requireNonNull(b.user, "user must not be null");
        this.allJobs = b.allJobs;
        this.maxJobs = b.maxJobs;
        this.dryRun = b.dryRun;
        if (maxJobs <= 0) {
            throw new IllegalArgumentException("maxJobs must be > 0");
        }
    }

    public String xgroup() {
        return xgroup;
    }

    public String user() {
        return user;
    }

    public boolean allJobs() {
        return allJobs;
    }

    public int maxJobs() {
        return maxJobs;
    }

    /**
     * When set, containers are not rebuilt and each spec keeps its recorded image.
     */
    public boolean dryRun() {
        return dryRun;
    }

    public static Builder builder(String user) {
        return new Builder(user);
    }

    public static final class Builder {
        private String xgroup;
        private final String user;
        private boolean allJobs;
        private int maxJobs = 8;
        private boolean dryRun;

        private Builder(String user) {
            this.user = user;
        }

        public Builder xgroup(String xgroup) {
            this.xgroup = xgroup;
            return this;
        }

        public Builder allJobs(boolean allJobs) {
            this.allJobs = allJobs;
            return this;
        }

        public Builder maxJobs(int maxJobs) {
            this.maxJobs = maxJobs;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public ResubmitRequest build() {
            return new ResubmitRequest(this);
        }
    }
}
