package com.di.taskpilot.adaptation;

import com.di.taskpilot.resource.MonitorState;
import com.di.taskpilot.scheduler.ThrottleLevel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class AdaptationStatus {
    boolean monitoringActive;
    boolean componentsLoaded;
    long adaptationCount;
    Instant lastAdaptation;
    int concurrentAdaptations;
    Map<String, Object> safetyLimits;
    double cpuUsage;
    double ramUsage;
    boolean safeToAdapt;
    MonitorState monitorState;
    ThrottleLevel throttleLevel;
}
