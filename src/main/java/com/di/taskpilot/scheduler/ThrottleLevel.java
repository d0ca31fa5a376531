package com.di.taskpilot.scheduler;

import com.di.taskpilot.resource.MonitorState;
import com.di.taskpilot.resource.ResourceSample;

/**
 * Severity tier capping scheduler concurrency. Declared in ascending severity.
 */
public enum ThrottleLevel {
    NONE,
    LIGHT,
    HEAVY,
    CRITICAL;

    /** Concurrency ceiling at this level given the configured maximum. */
    public int ceiling(int maxConcurrent) {
        return switch (this) {
            case NONE -> maxConcurrent;
            case LIGHT -> Math.max(0, maxConcurrent - 1);
            case HEAVY -> Math.min(1, maxConcurrent);
            case CRITICAL -> 0;
        };
    }

    /** HEAVY admits the top two priorities, LIGHT the top three. */
    public boolean admits(TaskPriority priority) {
        return switch (this) {
            case NONE -> true;
            case LIGHT -> priority.value() <= TaskPriority.NORMAL.value();
            case HEAVY -> priority.value() <= TaskPriority.HIGH.value();
            case CRITICAL -> false;
        };
    }

    public static ThrottleLevel fromState(MonitorState state) {
        return switch (state) {
            case CRITICAL -> CRITICAL;
            case ALERT -> HEAVY;
            case ACTIVE, IDLE -> NONE;
        };
    }

    public static ThrottleLevel fromSample(ResourceSample s) {
        if (s.cpuPercent() >= 80 || s.memPercent() >= 70) return CRITICAL;
        if (s.cpuPercent() >= 70 || s.memPercent() >= 60) return HEAVY;
        if (s.cpuPercent() >= 50 || s.memPercent() >= 45) return LIGHT;
        return NONE;
    }

    public static ThrottleLevel max(ThrottleLevel a, ThrottleLevel b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
