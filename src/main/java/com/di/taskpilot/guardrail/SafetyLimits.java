package com.di.taskpilot.guardrail;

import java.time.Duration;

/**
 * Hard safety ceilings. Deliberately not bound from configuration.
 */
public final class SafetyLimits {

    private SafetyLimits() {
    }

    /** Host CPU ceiling, percent. */
    public static final double CPU_CEILING_PERCENT = 80.0;
    /** Host memory ceiling, percent. */
    public static final double MEM_CEILING_PERCENT = 70.0;
    /** Fraction of a ceiling above which the monitor reports ALERT. */
    public static final double ALERT_FRACTION = 0.85;

    /** Same ceilings expressed as fractions, as used by the adaptation gates. */
    public static final double CPU_MAX = CPU_CEILING_PERCENT / 100.0;
    public static final double RAM_MAX = MEM_CEILING_PERCENT / 100.0;

    /** CPU an adaptation may add on top of current usage (fraction). */
    public static final double ADAPTATION_CPU_BUDGET = 0.05;
    /** Memory an adaptation may add on top of current usage. */
    public static final long ADAPTATION_RAM_BUDGET_BYTES = 50L * 1024 * 1024;
    /** Margin kept below the ceilings before metric collection is throttled (fraction). */
    public static final double MONITOR_BUFFER = 0.05;

    public static final Duration MIN_ADAPTATION_INTERVAL = Duration.ofSeconds(5);
    public static final int MAX_CONCURRENT_ADAPTATIONS = 2;
}
