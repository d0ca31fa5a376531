package com.di.taskpilot.router;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of a provider switch, stamped with the time the outcome was decided. Failures are ordinary values
 * carrying a stable reason code.
 */
public record AdaptationResult(boolean success, String reason, Map<String, Object> details, Instant timestamp) {

    public static final String TASK_NOT_FOUND = "task_not_found";
    public static final String NO_ALTERNATIVE_PROVIDER = "no_alternative_provider";
    public static final String ALTERNATIVE_UNHEALTHY = "alternative_unhealthy";
    public static final String PERMISSION_DENIED = "permission_denied";
    public static final String SAFETY_LIMITS_EXCEEDED = "safety_limits_exceeded";
    public static final String RATE_LIMITED = "rate_limited";
    public static final String MAX_CONCURRENT_ADAPTATIONS = "max_concurrent_adaptations";

    public AdaptationResult {
        if (timestamp == null) throw new IllegalArgumentException("timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static AdaptationResult success(String reason, Map<String, Object> details, Instant timestamp) {
        return new AdaptationResult(true, reason, details, timestamp);
    }

    public static AdaptationResult failure(String reason, Map<String, Object> details, Instant timestamp) {
        return new AdaptationResult(false, reason, details, timestamp);
    }
}
