package io.caliban4j.core;

/**
 * Compute platforms a job can be submitted to.
 */
public enum Platform {
    CAIP {
        @Override
        public PlatformJobStatus parseStatus(String status) {
            return CaipJobStatus.parse(status);
        }
    },
    GKE {
        @Override
        public PlatformJobStatus parseStatus(String status) {
            return valueOrDefault(GkeJobStatus.class, status, GkeJobStatus.STATE_UNSPECIFIED);
        }
    },
    LOCAL {
        @Override
        public PlatformJobStatus parseStatus(String status) {
            return valueOrDefault(LocalJobStatus.class, status, JobStatus.UNKNOWN);
        }
    },
    TEST {
        @Override
        public PlatformJobStatus parseStatus(String status) {
            return valueOrDefault(TestJobStatus.class, status, JobStatus.UNKNOWN);
        }
    };

    /**
     * Parses a platform-native status name. Unrecognised names map to a non-terminal value.
     */
    public abstract PlatformJobStatus parseStatus(String status);

    private static <E extends Enum<E> & PlatformJobStatus> PlatformJobStatus valueOrDefault(
            Class<E> type, String status, PlatformJobStatus fallback) {
        if (status == null || status.isBlank()) {
            return fallback;
        }
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(status.trim())) {
                return e;
            }
        }
        return fallback;
    }
}
