package com.di.taskpilot.router;

import java.time.Instant;

/**
 * Health snapshot for one provider.
 *
 * @param avgResponseTime EMA of successful response times in seconds, 0 until the first one
 */
public record ProviderHealth(String providerId,
                             ProviderStatus status,
                             int consecutiveFailures,
                             double avgResponseTime,
                             Instant lastCheck,
                             Instant lastSuccess) {

    static ProviderHealth initial(String providerId, Instant now) {
        return new ProviderHealth(providerId, ProviderStatus.HEALTHY, 0, 0.0, now, null);
    }

    ProviderHealth onSuccess(Double responseTime, double alpha, Instant now) {
        double avg = avgResponseTime;
        if (responseTime != null) {
            avg = avgResponseTime == 0.0 ? responseTime : alpha * responseTime + (1 - alpha) * avgResponseTime;
        }
        return new ProviderHealth(providerId, ProviderStatus.afterSuccess(responseTime), 0, avg, now, now);
    }

    ProviderHealth onFailure(int offlineAfter, Instant now) {
        int failures = consecutiveFailures + 1;
        return new ProviderHealth(providerId, ProviderStatus.afterFailures(failures, offlineAfter), failures,
                avgResponseTime, now, lastSuccess);
    }
}
