package com.di.taskpilot.router;

public record SwitchDecision(boolean shouldSwitch, String reason) {

    public static final String LATENCY_SPIKE = "latency_spike";
    public static final String ERROR_THRESHOLD = "error_threshold";
    public static final String HEALTH_CHECK_FAILURE = "health_check_failure";
    public static final String TASK_NOT_ACTIVE = "task_not_active";
    public static final String NO_SWITCH_NEEDED = "no_switch_needed";

    static SwitchDecision yes(String reason) {
        return new SwitchDecision(true, reason);
    }

    static SwitchDecision no(String reason) {
        return new SwitchDecision(false, reason);
    }
}
