package com.di.taskpilot.adaptation;

import com.di.taskpilot.audit.AuditTrail;
import com.di.taskpilot.guardrail.AuthorizationDecision;
import com.di.taskpilot.guardrail.AuthorizationService;
import com.di.taskpilot.guardrail.SafetyLimits;
import com.di.taskpilot.learner.ExecutionObservation;
import com.di.taskpilot.learner.PatternInsights;
import com.di.taskpilot.learner.ScoredPattern;
import com.di.taskpilot.metrics.MetricRecord;
import com.di.taskpilot.resource.ResourceMonitor;
import com.di.taskpilot.resource.ResourceSample;
import com.di.taskpilot.router.AdaptationResult;
import com.di.taskpilot.router.RoutingDecision;
import com.di.taskpilot.router.SwitchDecision;
import com.di.taskpilot.scheduler.PriorityScheduler;
import com.di.taskpilot.tracker.DegradationAlert;
import com.di.taskpilot.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Single entry point for monitoring, routing and live provider switches under the fixed {@link SafetyLimits}.
 * <p>
 * Adaptation gates run in order: authorization, resource headroom for the adaptation budget, minimum interval
 * since the last successful adaptation, in-flight adaptation cap. The interval and cap gates are checked and
 * reserved in one step; an adaptation still in flight counts from its admission time. Each rejection is returned
 * as a failed {@link AdaptationResult} and audited. The tracker, learner and router are resolved on first use.
 */
@Slf4j
@Service
public class AdaptationOrchestrator {

    private final Supplier<AdaptationComponents> componentsSupplier;
    private final ResourceMonitor monitor;
    private final PriorityScheduler scheduler;
    private final AuthorizationService authorization;
    private final AuditTrail audit;
    private final MetricsCollector metrics;
    private final Clock clock;

    private volatile AdaptationComponents components;
    private final Object initLock = new Object();
    private final AtomicBoolean monitoringActive = new AtomicBoolean(false);
    private final AtomicLong adaptationCount = new AtomicLong();

    private final Object gateLock = new Object();
    private final List<Instant> pendingAdaptations = new ArrayList<>();
    private volatile Instant lastAdaptation;

    @Autowired
    public AdaptationOrchestrator(ObjectProvider<AdaptationComponents> components,
                                  ResourceMonitor monitor,
                                  PriorityScheduler scheduler,
                                  AuthorizationService authorization,
                                  AuditTrail audit,
                                  MetricsCollector metrics,
                                  Clock clock) {
        this(components::getObject, monitor, scheduler, authorization, audit, metrics, clock);
    }

    AdaptationOrchestrator(Supplier<AdaptationComponents> componentsSupplier,
                           ResourceMonitor monitor,
                           PriorityScheduler scheduler,
                           AuthorizationService authorization,
                           AuditTrail audit,
                           MetricsCollector metrics,
                           Clock clock) {
        this.componentsSupplier = componentsSupplier;
        this.monitor = monitor;
        this.scheduler = scheduler;
        this.authorization = authorization;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
        log.info("[ADAPT] Orchestrator ready (components load on first use)");
    }

    private AdaptationComponents components() {
        AdaptationComponents c = components;
        if (c == null) {
            synchronized (initLock) {
                c = components;
                if (c == null) {
                    log.info("[ADAPT] Initializing tracker, learner and router");
                    c = componentsSupplier.get();
                    c.learner().forgetStale();
                    components = c;
                }
            }
        }
        return c;
    }

    // ------------------------------------------------------------------ //
    // Monitoring lifecycle                                                //
    // ------------------------------------------------------------------ //

    public void startMonitoring() {
        components();
        if (monitoringActive.compareAndSet(false, true)) {
            log.info("[ADAPT] Monitoring started");
        } else {
            log.warn("[ADAPT] Monitoring already active");
        }
    }

    /** Flushes buffered metrics; components stay loaded. */
    public void stopMonitoring() {
        if (monitoringActive.compareAndSet(true, false)) {
            AdaptationComponents c = components;
            if (c != null && !c.tracker().flush()) {
                log.warn("[ADAPT] Final metrics flush failed; {} record(s) remain buffered",
                        c.tracker().bufferedCount());
            }
            log.info("[ADAPT] Monitoring stopped");
        }
    }

    public boolean isMonitoringActive() {
        return monitoringActive.get();
    }

    /**
     * Collects metrics for a running task unless the host is within the monitoring buffer of a ceiling, in
     * which case a throttled result is returned and nothing is collected.
     */
    public MonitorResult monitorExecution(String taskId, String providerId) {
        AuthorizationDecision decision = authorization.authorize(AuthorizationService.OP_MONITOR_EXECUTION, providerId);
        ResourceSample sample = monitor.sample();
        double cpu = sample.cpuPercent() / 100.0;
        double ram = sample.memPercent() / 100.0;
        if (!decision.allowed()) {
            return MonitorResult.builder().taskId(taskId).providerId(providerId)
                    .status(MonitorResult.Status.DENIED).reason(decision.reason())
                    .cpuUsage(cpu).ramUsage(ram).build();
        }
        if (!safeToMonitor(cpu, ram)) {
            log.debug("[ADAPT] Monitoring of {} throttled (cpu={}, ram={})", taskId, cpu, ram);
            return MonitorResult.builder().taskId(taskId).providerId(providerId)
                    .status(MonitorResult.Status.THROTTLED).reason("resource_limits")
                    .cpuUsage(cpu).ramUsage(ram).build();
        }
        if (!monitoringActive.get()) {
            startMonitoring();
        }
        AdaptationComponents c = components();
        MetricRecord record = c.tracker().collectMetrics(taskId, providerId);
        SwitchDecision switchDecision = c.router().shouldSwitch(taskId, record);
        return MonitorResult.builder().taskId(taskId).providerId(providerId)
                .status(MonitorResult.Status.OK)
                .metrics(record)
                .switchDecision(switchDecision)
                .cpuUsage(cpu).ramUsage(ram).build();
    }

    // ------------------------------------------------------------------ //
    // Routing and completion                                              //
    // ------------------------------------------------------------------ //

    /**
     * Routes the task, registers it as started on the chosen provider and begins timing it.
     */
    public RoutingDecision route(String taskKind, String taskId) {
        AdaptationComponents c = components();
        RoutingDecision decision = c.router().route(taskKind, taskId);
        c.router().registerStart(taskId, decision.getProviderId(), taskKind);
        c.tracker().startTiming(taskId, decision.getProviderId());
        audit.emit("route", taskId, decision.getReason(), decision.getProviderId(),
                Map.of("task_kind", taskKind, "confidence", decision.getConfidence(),
                        "fallback_chain", decision.getFallbackChain()));
        return decision;
    }

    /**
     * Feeds a finished task to the router (health, baseline, load), the tracker (timing, error counters) and
     * the learner (pattern update).
     *
     * @param responseTime seconds, may be null
     * @param observation  may be null
     * @return false when the task was not routed through this orchestrator
     */
    public boolean completeTask(String taskId, String taskKind, boolean success, Double responseTime,
                                ExecutionObservation observation) {
        AdaptationComponents c = components();
        Optional<String> provider = c.router().providerFor(taskId);
        if (provider.isEmpty()) {
            log.warn("[ADAPT] completeTask for unknown task {}", taskId);
            return false;
        }
        c.router().registerCompletion(taskId, success, responseTime);
        if (c.tracker().isTiming(taskId)) {
            c.tracker().endTiming(taskId, success);
        }
        c.learner().recordExecution(taskKind, provider.get(), observation, success);
        return true;
    }

    // ------------------------------------------------------------------ //
    // Adaptation                                                          //
    // ------------------------------------------------------------------ //

    public AdaptationResult triggerAdaptation(String taskId, String reason) {
        return triggerAdaptation(taskId, reason, null);
    }

    public AdaptationResult triggerAdaptation(String taskId, String reason, String alternative) {
        AuthorizationDecision decision = authorization.authorize(AuthorizationService.OP_TRIGGER_ADAPTATION, alternative);
        if (!decision.allowed()) {
            return rejected(taskId, AdaptationResult.PERMISSION_DENIED,
                    detailsOf("authorization", decision.reason()));
        }

        ResourceSample sample = monitor.sample();
        double cpu = sample.cpuPercent() / 100.0;
        double ram = sample.memPercent() / 100.0;
        if (!safeToAdapt(sample)) {
            return rejected(taskId, AdaptationResult.SAFETY_LIMITS_EXCEEDED, Map.of(
                    "cpu", cpu, "ram", ram,
                    "cpu_limit", SafetyLimits.CPU_MAX, "ram_limit", SafetyLimits.RAM_MAX));
        }

        Instant reservation;
        synchronized (gateLock) {
            Instant now = clock.instant();
            Instant last = latestAdmitted();
            if (last != null && Duration.between(last, now).compareTo(SafetyLimits.MIN_ADAPTATION_INTERVAL) <= 0) {
                return rejected(taskId, AdaptationResult.RATE_LIMITED, Map.of(
                        "last_adaptation", last.toString(),
                        "min_interval_seconds", SafetyLimits.MIN_ADAPTATION_INTERVAL.getSeconds()));
            }
            int inFlight = pendingAdaptations.size();
            if (inFlight >= SafetyLimits.MAX_CONCURRENT_ADAPTATIONS) {
                return rejected(taskId, AdaptationResult.MAX_CONCURRENT_ADAPTATIONS, Map.of(
                        "current", inFlight, "max", SafetyLimits.MAX_CONCURRENT_ADAPTATIONS));
            }
            reservation = now;
            pendingAdaptations.add(reservation);
        }

        AdaptationComponents c = null;
        AdaptationResult result = null;
        try {
            c = components();
            result = c.router().adapt(taskId, reason, alternative);
        } finally {
            release(reservation, result != null && result.success());
        }
        if (result.success()) {
            c.learner().recordAdaptation(taskId, true, result.reason());
            log.info("[ADAPT] Task {} adapted: {} {}", taskId, result.reason(), result.details());
        } else {
            log.info("[ADAPT] Task {} not adapted: {}", taskId, result.reason());
        }
        metrics.recordAdaptation(result.success(), result.reason());
        audit.emit("switch", taskId, result.reason(), stringDetail(result, "new_provider"), result.details());
        return result;
    }

    /**
     * Newest of the last successful adaptation and the admission times of adaptations still in flight.
     * Caller holds {@link #gateLock}.
     */
    private Instant latestAdmitted() {
        Instant latest = lastAdaptation;
        for (Instant pending : pendingAdaptations) {
            if (latest == null || pending.isAfter(latest)) latest = pending;
        }
        return latest;
    }

    /**
     * Frees the in-flight slot; a successful adaptation keeps its admission time as the last adaptation.
     */
    private void release(Instant reservation, boolean succeeded) {
        synchronized (gateLock) {
            pendingAdaptations.remove(reservation);
            if (succeeded) {
                adaptationCount.incrementAndGet();
                if (lastAdaptation == null || reservation.isAfter(lastAdaptation)) {
                    lastAdaptation = reservation;
                }
            }
        }
    }

    /**
     * Runs the router's switch check for the task and, when it fires, a gated adaptation with the check's
     * reason.
     *
     * @return empty when no switch is needed
     */
    public Optional<AdaptationResult> checkAndAdapt(String taskId, MetricRecord current) {
        SwitchDecision decision = components().router().shouldSwitch(taskId, current);
        if (!decision.shouldSwitch()) {
            return Optional.empty();
        }
        log.info("[ADAPT] Switch suggested for {}: {}", taskId, decision.reason());
        return Optional.of(triggerAdaptation(taskId, decision.reason()));
    }

    private AdaptationResult rejected(String taskId, String reason, Map<String, Object> details) {
        log.warn("[ADAPT] Adaptation of {} rejected: {}", taskId, reason);
        metrics.recordAdaptation(false, reason);
        audit.emit("safety_gate", taskId, reason, null, details);
        return AdaptationResult.failure(reason, details, clock.instant());
    }

    private static Map<String, Object> detailsOf(String key, Object value) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (value != null) details.put(key, value);
        return details;
    }

    private static String stringDetail(AdaptationResult result, String key) {
        Object v = result.details().get(key);
        return v != null ? v.toString() : null;
    }

    // ------------------------------------------------------------------ //
    // Safety checks                                                       //
    // ------------------------------------------------------------------ //

    static boolean safeToMonitor(double cpu, double ram) {
        return cpu < SafetyLimits.CPU_MAX - SafetyLimits.MONITOR_BUFFER
                && ram < SafetyLimits.RAM_MAX - SafetyLimits.MONITOR_BUFFER;
    }

    /** Current usage plus the adaptation budget must stay within both ceilings. */
    static boolean safeToAdapt(ResourceSample sample) {
        double cpu = sample.cpuPercent() / 100.0;
        double ram = sample.memPercent() / 100.0;
        long total = sample.memTotal();
        double ramBudget = total > 0 ? (double) SafetyLimits.ADAPTATION_RAM_BUDGET_BYTES / total : 0.0;
        return cpu + SafetyLimits.ADAPTATION_CPU_BUDGET <= SafetyLimits.CPU_MAX
                && ram + ramBudget <= SafetyLimits.RAM_MAX;
    }

    // ------------------------------------------------------------------ //
    // Queries                                                             //
    // ------------------------------------------------------------------ //

    public AdaptationStatus status() {
        ResourceSample sample = monitor.sample();
        Map<String, Object> limits = new LinkedHashMap<>();
        limits.put("cpu_max", SafetyLimits.CPU_MAX);
        limits.put("ram_max", SafetyLimits.RAM_MAX);
        limits.put("adaptation_cpu_budget", SafetyLimits.ADAPTATION_CPU_BUDGET);
        limits.put("adaptation_ram_budget_bytes", SafetyLimits.ADAPTATION_RAM_BUDGET_BYTES);
        limits.put("min_adaptation_interval_seconds", SafetyLimits.MIN_ADAPTATION_INTERVAL.getSeconds());
        limits.put("max_concurrent_adaptations", SafetyLimits.MAX_CONCURRENT_ADAPTATIONS);
        return AdaptationStatus.builder()
                .monitoringActive(monitoringActive.get())
                .componentsLoaded(components != null)
                .adaptationCount(adaptationCount.get())
                .lastAdaptation(lastAdaptation)
                .concurrentAdaptations(inFlightAdaptations())
                .safetyLimits(limits)
                .cpuUsage(sample.cpuPercent() / 100.0)
                .ramUsage(sample.memPercent() / 100.0)
                .safeToAdapt(safeToAdapt(sample))
                .monitorState(monitor.state())
                .throttleLevel(scheduler.throttleLevel())
                .build();
    }

    /** Learned patterns for the kind, highest confidence first. */
    public List<ScoredPattern> recommendations(String taskKind) {
        return components().learner().patternsFor(taskKind);
    }

    public PatternInsights analyzePatterns() {
        return components().learner().analyzePatterns();
    }

    /** Sweeps every recently seen provider and audits each alert. */
    public List<DegradationAlert> detectDegradations() {
        List<DegradationAlert> alerts = components().tracker().detectAllDegradations();
        for (DegradationAlert alert : alerts) {
            audit.emit("degradation_alert", alert.getMetric().name().toLowerCase(), alert.getSeverity().name(),
                    alert.getProviderId(), Map.of("description", alert.getDescription()));
        }
        return alerts;
    }

    public AdaptationComponents loadedComponents() {
        return components();
    }

    public int inFlightAdaptations() {
        synchronized (gateLock) {
            return pendingAdaptations.size();
        }
    }

    public long adaptationCount() {
        return adaptationCount.get();
    }
}
