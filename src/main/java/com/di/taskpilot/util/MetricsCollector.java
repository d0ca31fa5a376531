package com.di.taskpilot.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the scheduler, the monitor and the adaptation loop.
 */
@Slf4j
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;

    private final Counter tasksCompleted;
    private final Counter tasksFailed;
    private final Counter tasksThrottled;
    private final Timer taskRuntime;
    private final Counter metricsFlushed;
    private final Counter metricsFlushFailures;
    private volatile double hostCpuPercent;
    private volatile double hostMemPercent;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.tasksCompleted = Counter.builder("taskpilot.scheduler.tasks.finished")
                .description("Tasks whose body returned normally")
                .tag("outcome", "completed")
                .register(meterRegistry);

        this.tasksFailed = Counter.builder("taskpilot.scheduler.tasks.finished")
                .description("Tasks whose body raised an error")
                .tag("outcome", "failed")
                .register(meterRegistry);

        this.tasksThrottled = Counter.builder("taskpilot.scheduler.tasks.throttled")
                .description("Tasks cancelled or flagged for exceeding max runtime")
                .register(meterRegistry);

        this.taskRuntime = Timer.builder("taskpilot.scheduler.task.runtime")
                .description("Wall-clock runtime of task bodies")
                .register(meterRegistry);

        this.metricsFlushed = Counter.builder("taskpilot.tracker.flushed")
                .description("Metric records written to the metrics store")
                .register(meterRegistry);

        this.metricsFlushFailures = Counter.builder("taskpilot.tracker.flush.failures")
                .description("Buffer flushes that failed and were kept for retry")
                .register(meterRegistry);

        Gauge.builder("taskpilot.monitor.cpu.percent", this, c -> c.hostCpuPercent)
                .description("Host CPU usage from the latest monitor sample")
                .register(meterRegistry);

        Gauge.builder("taskpilot.monitor.mem.percent", this, c -> c.hostMemPercent)
                .description("Host memory usage from the latest monitor sample")
                .register(meterRegistry);
    }

    public void recordTaskScheduled(String priority) {
        meterRegistry.counter("taskpilot.scheduler.tasks.scheduled", "priority", priority).increment();
    }

    public void recordTaskRejected(String reason) {
        meterRegistry.counter("taskpilot.scheduler.tasks.rejected", "reason", reason).increment();
    }

    public void recordTaskCompleted(Duration runtime) {
        tasksCompleted.increment();
        taskRuntime.record(runtime);
    }

    public void recordTaskFailed(Duration runtime, String category) {
        tasksFailed.increment();
        taskRuntime.record(runtime);
        meterRegistry.counter("taskpilot.scheduler.tasks.failure.category", "category", category).increment();
    }

    public void recordTaskThrottled() {
        tasksThrottled.increment();
    }

    public void recordMonitorTransition(String state) {
        meterRegistry.counter("taskpilot.monitor.transitions", "state", state).increment();
    }

    public void recordResourceSample(double cpuPercent, double memPercent) {
        this.hostCpuPercent = cpuPercent;
        this.hostMemPercent = memPercent;
    }

    public void recordAdaptation(boolean success, String reason) {
        meterRegistry.counter("taskpilot.adaptation.attempts",
                "success", String.valueOf(success),
                "reason", reason != null ? reason : "none").increment();
    }

    public void recordMetricsFlushed(int count) {
        metricsFlushed.increment(count);
    }

    public void recordMetricsFlushFailure() {
        metricsFlushFailures.increment();
    }
}
