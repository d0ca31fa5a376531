package com.di.taskpilot.scheduler;

/**
 * Body of a scheduled task. Long-running bodies should poll {@link ScheduledTask#isCancelled()}.
 */
@FunctionalInterface
public interface TaskCallback {
    void run(ScheduledTask task) throws Exception;
}
