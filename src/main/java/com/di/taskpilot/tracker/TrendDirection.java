package com.di.taskpilot.tracker;

public enum TrendDirection {
    IMPROVING,
    DEGRADING,
    STABLE,
    INSUFFICIENT_DATA
}
