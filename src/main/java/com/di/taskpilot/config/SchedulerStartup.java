package com.di.taskpilot.config;

import com.di.taskpilot.adaptation.AdaptationOrchestrator;
import com.di.taskpilot.metrics.MetricsProperties;
import com.di.taskpilot.metrics.MetricsStore;
import com.di.taskpilot.metrics.MetricsStoreException;
import com.di.taskpilot.resource.ResourceMonitor;
import com.di.taskpilot.scheduler.PriorityScheduler;
import com.di.taskpilot.scheduler.SchedulerProperties;
import com.di.taskpilot.util.MetricsCollector;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Starts the monitor and scheduler loops when taskpilot.scheduler.auto-start=true, runs the metrics
 * retention sweep once, and stops everything on context close.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class SchedulerStartup implements ApplicationRunner {

    private final ResourceMonitor monitor;
    private final PriorityScheduler scheduler;
    private final SchedulerProperties schedulerProperties;
    private final MetricsStore metricsStore;
    private final MetricsProperties metricsProperties;
    private final MetricsCollector metricsCollector;
    private final AdaptationOrchestrator orchestrator;

    @Override
    public void run(ApplicationArguments args) {
        monitor.addStateListener((previous, current, sample) -> metricsCollector.recordMonitorTransition(current.name()));
        monitor.addSampleListener(sample -> metricsCollector.recordResourceSample(sample.cpuPercent(), sample.memPercent()));
        sweepRetention();
        if (!schedulerProperties.isAutoStart()) {
            log.info("[SCHEDULER] auto-start disabled; monitor and scheduler left stopped");
            return;
        }
        monitor.start();
        scheduler.start();
        log.info("[SCHEDULER] Monitor and scheduler started (state={}, maxConcurrent={})", monitor.state(),
                schedulerProperties.getMaxConcurrent());
    }

    private void sweepRetention() {
        try {
            int deleted = metricsStore.deleteOlderThan(metricsProperties.getRetentionDays());
            if (deleted > 0) {
                log.info("[STORE] Retention sweep removed {} record(s) older than {} day(s)", deleted,
                        metricsProperties.getRetentionDays());
            }
        } catch (MetricsStoreException e) {
            log.warn("[STORE] Retention sweep failed: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        orchestrator.stopMonitoring();
        scheduler.stop();
        monitor.stop();
        log.info("[SCHEDULER] Monitor and scheduler stopped");
    }
}
