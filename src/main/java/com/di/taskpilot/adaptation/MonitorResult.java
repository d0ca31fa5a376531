package com.di.taskpilot.adaptation;

import com.di.taskpilot.metrics.MetricRecord;
import com.di.taskpilot.router.SwitchDecision;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Result of monitoring one execution. Only {@link Status#OK} carries metrics.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MonitorResult {

    public enum Status {
        OK,
        THROTTLED,
        DENIED
    }

    String taskId;
    String providerId;
    Status status;
    String reason;
    MetricRecord metrics;
    SwitchDecision switchDecision;
    /** Host CPU as a fraction at the time of the check. */
    double cpuUsage;
    /** Host RAM as a fraction at the time of the check. */
    double ramUsage;

    public boolean isThrottled() {
        return status == Status.THROTTLED;
    }
}
