package com.di.taskpilot.router;

/**
 * Health state of a provider. HEALTHY and DEGRADED still receive work.
 */
public enum ProviderStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    OFFLINE;

    public boolean isUsable() {
        return switch (this) {
            case HEALTHY, DEGRADED -> true;
            case UNHEALTHY, OFFLINE -> false;
        };
    }

    /** Status after the given number of consecutive failures (at least one). */
    static ProviderStatus afterFailures(int consecutiveFailures, int offlineAfter) {
        if (consecutiveFailures >= offlineAfter) return OFFLINE;
        if (consecutiveFailures >= 2) return UNHEALTHY;
        return DEGRADED;
    }

    /**
     * Status after a success: between 1s and 5s of response time is DEGRADED, anything else HEALTHY.
     */
    static ProviderStatus afterSuccess(Double responseTimeSeconds) {
        if (responseTimeSeconds != null && responseTimeSeconds >= 1.0 && responseTimeSeconds < 5.0) {
            return DEGRADED;
        }
        return HEALTHY;
    }
}
