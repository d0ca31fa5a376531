package com.di.taskpilot.tracker;

public enum AlertSeverity {
    MEDIUM,
    HIGH,
    CRITICAL
}
