package com.di.taskpilot.tracker;

import com.di.taskpilot.metrics.MetricRecord;

import java.util.Locale;

/** Named numeric field of a {@link MetricRecord}. */
public enum TrackedMetric {
    LATENCY(true),
    CPU_USAGE(true),
    RAM_USAGE(true),
    THROUGHPUT(false),
    ERROR_RATE(true),
    QUEUE_DEPTH(true);

    private final boolean lowerIsBetter;

    TrackedMetric(boolean lowerIsBetter) {
        this.lowerIsBetter = lowerIsBetter;
    }

    public boolean lowerIsBetter() {
        return lowerIsBetter;
    }

    public double valueOf(MetricRecord r) {
        return switch (this) {
            case LATENCY -> r.getLatency();
            case CPU_USAGE -> r.getCpuUsage();
            case RAM_USAGE -> r.getRamUsage();
            case THROUGHPUT -> r.getThroughput();
            case ERROR_RATE -> r.getErrorRate();
            case QUEUE_DEPTH -> r.getQueueDepth();
        };
    }

    /** Accepts {@code latency}, {@code error_rate}, {@code error-rate} or the constant name. */
    public static TrackedMetric fromName(String name) {
        if (name == null || name.isBlank()) return LATENCY;
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
