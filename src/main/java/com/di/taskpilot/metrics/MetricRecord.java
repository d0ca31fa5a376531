package com.di.taskpilot.metrics;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One observation of a task on a provider. Append-only once stored.
 */
@Value
@Builder(toBuilder = true)
public class MetricRecord {
    String taskId;
    String providerId;
    Instant timestamp;
    /** Seconds since the task's timing started; 0 when no start was recorded. */
    double latency;
    /** Fraction of host CPU, 0-1. */
    double cpuUsage;
    /** Fraction of host memory, 0-1. */
    double ramUsage;
    /** Completed tasks per second over the current throughput window. */
    double throughput;
    /** Provider's errors / (errors + completions), 0-1. */
    double errorRate;
    /** Tasks being timed when the record was taken. */
    int queueDepth;
    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
