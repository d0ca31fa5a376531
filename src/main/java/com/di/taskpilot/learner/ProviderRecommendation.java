package com.di.taskpilot.learner;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProviderRecommendation {
    String providerId;
    double confidence;
    /** Human-readable justification tier. */
    String reason;
    ResourceProfile resourceEstimate;
    double successRate;
    long executionCount;
}
