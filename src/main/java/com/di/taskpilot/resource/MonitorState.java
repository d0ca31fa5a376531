package com.di.taskpilot.resource;

import java.time.Duration;

/**
 * Discrete operating state derived from the latest sample. Declared in ascending severity.
 */
public enum MonitorState {
    IDLE,
    ACTIVE,
    ALERT,
    CRITICAL;

    public boolean isMoreSevereThan(MonitorState other) {
        return ordinal() > other.ordinal();
    }

    /** Default polling interval; overridden per state by {@link ResourceMonitorProperties}. */
    public Duration defaultPollInterval() {
        return switch (this) {
            case IDLE -> Duration.ofSeconds(8);
            case ACTIVE -> Duration.ofSeconds(4);
            case ALERT -> Duration.ofSeconds(2);
            case CRITICAL -> Duration.ofSeconds(1);
        };
    }
}
