package com.di.taskpilot.scheduler;

public enum TaskState {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    /** Cancelled, or flagged for exceeding its max runtime. The body is not interrupted. */
    THROTTLED
}
