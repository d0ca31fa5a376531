package com.di.taskpilot.metrics;

import java.time.Instant;

public record MetricsStoreStats(long totalRecords, int providerCount, Instant oldestRecord, Instant newestRecord, String backend) {
}
