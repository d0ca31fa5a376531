package com.di.taskpilot.resource;

import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.time.Clock;

/**
 * Reads host CPU and memory through the platform {@link com.sun.management.OperatingSystemMXBean}.
 * Falls back to JVM heap figures when the extended bean is unavailable.
 */
@Slf4j
public class SystemResourceProbe implements ResourceProbe {

    private final Clock clock;
    private final com.sun.management.OperatingSystemMXBean osBean;

    public SystemResourceProbe(Clock clock) {
        this.clock = clock;
        java.lang.management.OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
        if (bean instanceof com.sun.management.OperatingSystemMXBean extended) {
            this.osBean = extended;
        } else {
            log.warn("[MONITOR] Extended OperatingSystemMXBean unavailable; reporting JVM heap as memory");
            this.osBean = null;
        }
    }

    @Override
    public ResourceSample read() {
        if (osBean == null) {
            Runtime rt = Runtime.getRuntime();
            long used = rt.totalMemory() - rt.freeMemory();
            long available = rt.maxMemory() - used;
            return new ResourceSample(clock.instant(), loadAverageCpuPercent(),
                    percent(used, used + available), used, available);
        }
        double load = osBean.getCpuLoad();
        double cpu = load >= 0 ? load * 100.0 : loadAverageCpuPercent();
        long total = osBean.getTotalMemorySize();
        long free = osBean.getFreeMemorySize();
        long used = Math.max(0L, total - free);
        return new ResourceSample(clock.instant(), cpu, percent(used, total), used, free);
    }

    private static double loadAverageCpuPercent() {
        double avg = ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage();
        if (avg < 0) return 0.0;
        int cpus = Math.max(1, Runtime.getRuntime().availableProcessors());
        return Math.min(100.0, avg / cpus * 100.0);
    }

    private static double percent(long part, long total) {
        return total <= 0 ? 0.0 : (double) part / total * 100.0;
    }
}
