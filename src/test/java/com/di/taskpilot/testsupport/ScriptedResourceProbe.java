package com.di.taskpilot.testsupport;

import com.di.taskpilot.resource.ResourceProbe;
import com.di.taskpilot.resource.ResourceSample;

import java.time.Clock;

/**
 * Probe returning whatever CPU/memory percentages the test last set, stamped with the test clock.
 */
public class ScriptedResourceProbe implements ResourceProbe {

    public static final long TOTAL_MEMORY = 16L * 1024 * 1024 * 1024;

    private final Clock clock;
    private volatile double cpuPercent;
    private volatile double memPercent;
    private volatile boolean failing;
    private volatile int reads;

    public ScriptedResourceProbe(Clock clock, double cpuPercent, double memPercent) {
        this.clock = clock;
        this.cpuPercent = cpuPercent;
        this.memPercent = memPercent;
    }

    public void set(double cpuPercent, double memPercent) {
        this.cpuPercent = cpuPercent;
        this.memPercent = memPercent;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public int reads() {
        return reads;
    }

    @Override
    public ResourceSample read() {
        reads++;
        if (failing) {
            throw new IllegalStateException("probe unavailable");
        }
        long used = (long) (TOTAL_MEMORY * memPercent / 100.0);
        return new ResourceSample(clock.instant(), cpuPercent, memPercent, used, TOTAL_MEMORY - used);
    }
}
