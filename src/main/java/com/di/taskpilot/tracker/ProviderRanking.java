package com.di.taskpilot.tracker;

import lombok.Builder;
import lombok.Value;

/** One row of {@link PerformanceTracker#rankings}; lower score ranks first. */
@Value
@Builder
public class ProviderRanking {
    String providerId;
    double score;
    int samples;
    double avgLatency;
    double avgErrorRate;
    double avgThroughput;
    double avgCpu;
    double avgRam;
    TrendDirection trend;
    double trendConfidence;
}
