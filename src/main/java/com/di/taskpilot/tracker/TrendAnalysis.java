package com.di.taskpilot.tracker;

/**
 * Least-squares fit over the most recent values of one metric.
 *
 * @param slope      change per sample
 * @param confidence R-squared of the fit, 0-1
 */
public record TrendAnalysis(TrackedMetric metric, double slope, TrendDirection direction, double confidence, int samples) {

    public static TrendAnalysis insufficient(TrackedMetric metric, int samples) {
        return new TrendAnalysis(metric, 0.0, TrendDirection.INSUFFICIENT_DATA, 0.0, samples);
    }
}
