package com.di.taskpilot.learner;

/**
 * @param cpu             fraction of host CPU
 * @param ramMb           MB
 * @param durationSeconds seconds
 */
public record ResourcePrediction(double cpu, double ramMb, double durationSeconds, double confidence, long sampleCount) {
}
