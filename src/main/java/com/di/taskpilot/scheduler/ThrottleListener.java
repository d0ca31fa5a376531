package com.di.taskpilot.scheduler;

@FunctionalInterface
public interface ThrottleListener {
    void onThrottleChange(ThrottleLevel previous, ThrottleLevel current);
}
