package com.di.taskpilot.scheduler;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class SchedulerStatus {
    boolean running;
    ThrottleLevel throttleLevel;
    int maxConcurrent;
    int effectiveConcurrency;
    List<String> activeTaskIds;
    Map<TaskPriority, Integer> pendingByPriority;
    long tasksScheduled;
    long tasksRejected;
    long tasksCompleted;
    long tasksFailed;
    long tasksThrottled;
    double totalRuntimeSeconds;
}
