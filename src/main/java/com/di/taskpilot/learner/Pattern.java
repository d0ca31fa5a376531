package com.di.taskpilot.learner;

import java.time.Instant;

/**
 * Learned behaviour of one (task kind, provider) pair.
 */
public record Pattern(String taskKind,
                      String providerId,
                      long executionCount,
                      double successRate,
                      ResourceProfile resourceProfile,
                      Instant lastUpdated) {

    /** Neutral prior for a pair that has never run. */
    public static final double INITIAL_SUCCESS_RATE = 0.5;

    public static Pattern create(String taskKind, String providerId, Instant now) {
        return new Pattern(taskKind, providerId, 0L, INITIAL_SUCCESS_RATE, ResourceProfile.EMPTY, now);
    }

    public Pattern record(ExecutionObservation observation, boolean success, double alpha, Instant now) {
        double outcome = success ? 1.0 : 0.0;
        ResourceProfile profile = observation != null ? resourceProfile.update(observation, alpha) : resourceProfile;
        return new Pattern(taskKind, providerId, executionCount + 1,
                ResourceProfile.ema(successRate, outcome, alpha), profile, now);
    }

    public String key() {
        return key(taskKind, providerId);
    }

    public static String key(String taskKind, String providerId) {
        return taskKind + ":" + providerId;
    }
}
