package com.di.taskpilot.resource;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/** Snapshot for the management surface. */
@Value
@Builder
public class MonitorStats {
    MonitorState state;
    Duration pollInterval;
    boolean running;
    double cpuPercent;
    double memPercent;
    /** Mean over the last ten samples. */
    double recentAvgCpu;
    double recentAvgMem;
    double cpuHeadroom;
    double memHeadroom;
    int historySize;
    int activeWork;
    long stateTransitions;
}
