package com.di.taskpilot.learner;

/**
 * EMA resource averages for one pattern. The first observation seeds the averages directly.
 */
public record ResourceProfile(double avgCpu, double avgRam, double avgDuration, long sampleCount) {

    public static final ResourceProfile EMPTY = new ResourceProfile(0.0, 0.0, 0.0, 0L);

    public ResourceProfile update(ExecutionObservation o, double alpha) {
        if (sampleCount == 0) {
            return new ResourceProfile(o.cpu(), o.ramMb(), o.durationSeconds(), 1L);
        }
        return new ResourceProfile(
                ema(avgCpu, o.cpu(), alpha),
                ema(avgRam, o.ramMb(), alpha),
                ema(avgDuration, o.durationSeconds(), alpha),
                sampleCount + 1);
    }

    static double ema(double old, double sample, double alpha) {
        return alpha * sample + (1 - alpha) * old;
    }
}
