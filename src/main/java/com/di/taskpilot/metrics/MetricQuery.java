package com.di.taskpilot.metrics;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Filter for {@link MetricsStore#query}. Null fields do not filter. Results are newest first.
 */
@Value
@Builder
public class MetricQuery {
    public static final int DEFAULT_LIMIT = 1000;

    String providerId;
    String taskId;
    Instant start;
    Instant end;
    @Builder.Default
    int limit = DEFAULT_LIMIT;

    public boolean matches(MetricRecord r) {
        return (providerId == null || providerId.equals(r.getProviderId()))
                && (taskId == null || taskId.equals(r.getTaskId()))
                && (start == null || !r.getTimestamp().isBefore(start))
                && (end == null || !r.getTimestamp().isAfter(end));
    }

    /** Cache key covering every filter field. */
    public String key() {
        return providerId + "|" + taskId + "|" + start + "|" + end + "|" + limit;
    }
}
