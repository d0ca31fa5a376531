package com.di.taskpilot.metrics;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Running aggregate per provider, maintained by the store on every insert. */
@Value
@Builder(toBuilder = true)
public class ProviderSummary {
    String providerId;
    long totalTasks;
    double avgLatency;
    double avgCpu;
    double avgRam;
    double errorRate;
    Instant lastUpdated;

    public static ProviderSummary first(MetricRecord r) {
        return ProviderSummary.builder()
                .providerId(r.getProviderId())
                .totalTasks(1)
                .avgLatency(r.getLatency())
                .avgCpu(r.getCpuUsage())
                .avgRam(r.getRamUsage())
                .errorRate(r.getErrorRate())
                .lastUpdated(r.getTimestamp())
                .build();
    }

    /** Incremental mean: {@code (avg * n + x) / (n + 1)}. */
    public ProviderSummary plus(MetricRecord r) {
        long n = totalTasks;
        return toBuilder()
                .totalTasks(n + 1)
                .avgLatency(runningMean(avgLatency, n, r.getLatency()))
                .avgCpu(runningMean(avgCpu, n, r.getCpuUsage()))
                .avgRam(runningMean(avgRam, n, r.getRamUsage()))
                .errorRate(runningMean(errorRate, n, r.getErrorRate()))
                .lastUpdated(r.getTimestamp())
                .build();
    }

    private static double runningMean(double avg, long n, double x) {
        return (avg * n + x) / (n + 1);
    }
}
