package com.di.taskpilot.tracker;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class DegradationAlert {
    String providerId;
    TrackedMetric metric;
    AlertSeverity severity;
    String description;
    Map<String, Double> details;
    Instant detectedAt;
}
