package com.di.taskpilot.tracker;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "taskpilot.tracker")
public class TrackerProperties {

    /** Buffered records are flushed to the store at this size. */
    private int bufferSize = 100;

    /** Upper bound on records kept while the store keeps failing; oldest are dropped beyond it. */
    private int maxBufferedRecords = 1000;

    /** Window used by history, rankings and degradation sweeps. */
    private int defaultWindowHours = 24;

    /** Samples fitted by {@link PerformanceTracker#trend}. */
    private int trendWindow = 50;

    /** Throughput is measured over windows of this length. */
    private Duration throughputWindow = Duration.ofSeconds(60);
}
