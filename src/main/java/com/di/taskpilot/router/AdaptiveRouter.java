package com.di.taskpilot.router;

import com.di.taskpilot.learner.ContextLearner;
import com.di.taskpilot.learner.ProviderRecommendation;
import com.di.taskpilot.learner.ScoredPattern;
import com.di.taskpilot.metrics.MetricRecord;
import com.di.taskpilot.tracker.PerformanceTracker;
import com.di.taskpilot.tracker.ProviderRanking;
import com.di.taskpilot.tracker.TrackedMetric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes new work to providers and decides when in-flight work should move.
 * <p>
 * Routing tries, in order: a learned pattern above the confidence threshold whose provider is usable; the
 * first usable provider under its load cap in the tracker's latency ranking; the default provider. Every
 * decision carries a fallback chain ending at the default provider.
 * <p>
 * Active tasks, load counters, health and baseline latency are guarded by one lock. Learner and tracker
 * queries run outside it.
 */
@Slf4j
@Lazy
@Component
public class AdaptiveRouter {

    static final String LEARNED_PATTERN = "learned_pattern";
    static final String PERFORMANCE_RANKING = "performance_ranking";
    static final String DEFAULT_FALLBACK = "default_fallback";
    static final double RANKING_CONFIDENCE = 0.6;
    static final double DEFAULT_CONFIDENCE = 0.3;

    private final PerformanceTracker tracker;
    private final ContextLearner learner;
    private final RouterProperties properties;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, ActiveTask> activeTasks = new HashMap<>();
    private final Map<String, Integer> providerLoad = new HashMap<>();
    private final Map<String, ProviderHealth> health = new LinkedHashMap<>();
    private final Map<String, Double> baselineLatency = new HashMap<>();

    private record ActiveTask(String providerId, String taskKind, Instant startedAt) {
    }

    public AdaptiveRouter(PerformanceTracker tracker, ContextLearner learner, RouterProperties properties, Clock clock) {
        this.tracker = tracker;
        this.learner = learner;
        this.properties = properties;
        this.clock = clock;
        log.info("[ROUTER] Initialized: default provider '{}', fallback chain {}", properties.getDefaultProvider(),
                properties.getMaxFallbackChain());
    }

    // ------------------------------------------------------------------ //
    // Routing                                                             //
    // ------------------------------------------------------------------ //

    public RoutingDecision route(String taskKind, String taskId) {
        Optional<ProviderRecommendation> rec = learner.recommend(taskKind);
        if (rec.isPresent()
                && rec.get().getConfidence() > properties.getLearnedConfidenceThreshold()
                && isUsable(rec.get().getProviderId())) {
            ProviderRecommendation r = rec.get();
            RoutingDecision decision = RoutingDecision.builder()
                    .taskId(taskId)
                    .providerId(r.getProviderId())
                    .fallbackChain(buildFallbackChain(r.getProviderId(), taskKind))
                    .reason(String.format("%s (confidence: %.0f%%)", LEARNED_PATTERN, r.getConfidence() * 100.0))
                    .confidence(r.getConfidence())
                    .estimatedResources(r.getResourceEstimate())
                    .build();
            log.info("[ROUTER] {} ({}) -> {} [{}]", taskId, taskKind, decision.getProviderId(), decision.getReason());
            return decision;
        }

        List<ProviderRanking> rankings = tracker.rankings(TrackedMetric.LATENCY);
        for (int i = 0; i < rankings.size(); i++) {
            String providerId = rankings.get(i).getProviderId();
            if (isUsable(providerId) && hasCapacity(providerId)) {
                RoutingDecision decision = RoutingDecision.builder()
                        .taskId(taskId)
                        .providerId(providerId)
                        .fallbackChain(buildFallbackChain(providerId, taskKind))
                        .reason(PERFORMANCE_RANKING + " (rank #" + (i + 1) + ")")
                        .confidence(RANKING_CONFIDENCE)
                        .build();
                log.info("[ROUTER] {} ({}) -> {} [{}]", taskId, taskKind, providerId, decision.getReason());
                return decision;
            }
        }

        String fallback = properties.getDefaultProvider();
        log.info("[ROUTER] {} ({}) -> {} [{}]: no usable learned or ranked provider", taskId, taskKind, fallback,
                DEFAULT_FALLBACK);
        return RoutingDecision.builder()
                .taskId(taskId)
                .providerId(fallback)
                .fallbackChain(List.of(fallback))
                .reason(DEFAULT_FALLBACK)
                .confidence(DEFAULT_CONFIDENCE)
                .build();
    }

    /**
     * Primary, then usable learned alternatives, then the default provider. The chain holds at most
     * {@code maxFallbackChain} entries and one slot is reserved for the default provider.
     */
    List<String> buildFallbackChain(String primary, String taskKind) {
        String fallback = properties.getDefaultProvider();
        int max = Math.max(2, properties.getMaxFallbackChain());
        List<String> chain = new ArrayList<>();
        chain.add(primary);
        for (ScoredPattern sp : learner.patternsFor(taskKind)) {
            String candidate = sp.providerId();
            if (chain.contains(candidate) || !isUsable(candidate)) continue;
            int reserved = chain.contains(fallback) || candidate.equals(fallback) ? 0 : 1;
            if (chain.size() + reserved >= max) break;
            chain.add(candidate);
        }
        if (!chain.contains(fallback)) {
            if (chain.size() >= max) chain.remove(chain.size() - 1);
            chain.add(fallback);
        }
        return List.copyOf(chain);
    }

    /**
     * Least-loaded usable candidate. Without candidates, uses learned patterns above the load-balancing
     * confidence, then the top five ranked providers, then the default provider.
     *
     * @return empty when candidates exist but none is usable
     */
    public Optional<String> loadBalance(String taskKind, List<String> candidates) {
        List<String> pool = candidates != null ? candidates : List.of();
        if (pool.isEmpty()) {
            pool = learner.patternsFor(taskKind).stream()
                    .filter(sp -> sp.confidence() > properties.getLoadBalanceConfidenceThreshold())
                    .map(ScoredPattern::providerId)
                    .toList();
        }
        if (pool.isEmpty()) {
            pool = tracker.rankings().stream().limit(5).map(ProviderRanking::getProviderId).toList();
        }
        if (pool.isEmpty()) {
            return Optional.of(properties.getDefaultProvider());
        }
        synchronized (lock) {
            String selected = null;
            int minLoad = Integer.MAX_VALUE;
            for (String providerId : pool) {
                if (!healthOf(providerId).status().isUsable()) continue;
                int load = providerLoad.getOrDefault(providerId, 0);
                if (load < minLoad) {
                    minLoad = load;
                    selected = providerId;
                }
            }
            return Optional.ofNullable(selected);
        }
    }

    // ------------------------------------------------------------------ //
    // Switching                                                           //
    // ------------------------------------------------------------------ //

    /**
     * Checks, in order: latency above the spike factor times the provider's baseline, error rate above the
     * threshold, provider no longer usable.
     */
    public SwitchDecision shouldSwitch(String taskId, MetricRecord current) {
        synchronized (lock) {
            ActiveTask task = activeTasks.get(taskId);
            if (task == null) {
                return SwitchDecision.no(SwitchDecision.TASK_NOT_ACTIVE);
            }
            Double baseline = baselineLatency.get(task.providerId());
            if (baseline != null && baseline > 0 && current != null
                    && current.getLatency() > baseline * properties.getLatencySpikeFactor()) {
                return SwitchDecision.yes(SwitchDecision.LATENCY_SPIKE);
            }
            if (current != null && current.getErrorRate() > properties.getErrorRateThreshold()) {
                return SwitchDecision.yes(SwitchDecision.ERROR_THRESHOLD);
            }
            if (!healthOf(task.providerId()).status().isUsable()) {
                return SwitchDecision.yes(SwitchDecision.HEALTH_CHECK_FAILURE);
            }
            return SwitchDecision.no(SwitchDecision.NO_SWITCH_NEEDED);
        }
    }

    /**
     * Moves an active task to {@code alternative}, or to the next usable provider from learned patterns,
     * rankings or the default when no alternative is given.
     */
    public AdaptationResult adapt(String taskId, String reason, String alternative) {
        ActiveTask task;
        synchronized (lock) {
            task = activeTasks.get(taskId);
        }
        if (task == null) {
            return AdaptationResult.failure(AdaptationResult.TASK_NOT_FOUND, Map.of("task_id", taskId), clock.instant());
        }

        String target = alternative != null ? alternative : findAlternative(task.providerId(), task.taskKind());
        if (target == null) {
            return AdaptationResult.failure(AdaptationResult.NO_ALTERNATIVE_PROVIDER,
                    Map.of("current_provider", task.providerId()), clock.instant());
        }

        synchronized (lock) {
            ActiveTask latest = activeTasks.get(taskId);
            if (latest == null) {
                return AdaptationResult.failure(AdaptationResult.TASK_NOT_FOUND, Map.of("task_id", taskId), clock.instant());
            }
            if (!healthOf(target).status().isUsable()) {
                return AdaptationResult.failure(AdaptationResult.ALTERNATIVE_UNHEALTHY, Map.of("alternative", target),
                        clock.instant());
            }
            Instant switchedAt = clock.instant();
            activeTasks.put(taskId, new ActiveTask(target, latest.taskKind(), switchedAt));
            decrementLoad(latest.providerId());
            incrementLoad(target);
            log.info("[ROUTER] Task {} switched {} -> {} (reason: {})", taskId, latest.providerId(), target, reason);
            return AdaptationResult.success("switched_" + reason, Map.of(
                    "old_provider", latest.providerId(),
                    "new_provider", target,
                    "switch_reason", reason), switchedAt);
        }
    }

    private String findAlternative(String current, String taskKind) {
        if (taskKind != null) {
            for (ScoredPattern sp : learner.patternsFor(taskKind)) {
                if (!sp.providerId().equals(current) && isUsable(sp.providerId())) return sp.providerId();
            }
        }
        for (ProviderRanking r : tracker.rankings()) {
            if (!r.getProviderId().equals(current) && isUsable(r.getProviderId())) return r.getProviderId();
        }
        return current.equals(properties.getDefaultProvider()) ? null : properties.getDefaultProvider();
    }

    // ------------------------------------------------------------------ //
    // Health and bookkeeping                                              //
    // ------------------------------------------------------------------ //

    /**
     * Success resets the failure count and classifies by response time; failures step DEGRADED, UNHEALTHY,
     * then OFFLINE.
     *
     * @param responseTime seconds, may be null
     */
    public ProviderHealth updateHealth(String providerId, boolean success, Double responseTime) {
        synchronized (lock) {
            return updateHealthLocked(providerId, success, responseTime);
        }
    }

    private ProviderHealth updateHealthLocked(String providerId, boolean success, Double responseTime) {
        Instant now = clock.instant();
        ProviderHealth previous = healthOf(providerId);
        ProviderHealth next = success
                ? previous.onSuccess(responseTime, properties.getEmaAlpha(), now)
                : previous.onFailure(properties.getMaxConsecutiveFailures(), now);
        health.put(providerId, next);
        if (next.status() != previous.status()) {
            log.info("[ROUTER] Provider {} {} -> {} (failures: {})", providerId, previous.status(), next.status(),
                    next.consecutiveFailures());
        }
        return next;
    }

    public void registerStart(String taskId, String providerId, String taskKind) {
        synchronized (lock) {
            ActiveTask previous = activeTasks.put(taskId, new ActiveTask(providerId, taskKind, clock.instant()));
            if (previous != null) decrementLoad(previous.providerId());
            incrementLoad(providerId);
        }
        log.debug("[ROUTER] Task {} started on {}", taskId, providerId);
    }

    /**
     * Updates health and baseline latency for the task's provider and releases its load slot.
     *
     * @return false when the task was not active
     */
    public boolean registerCompletion(String taskId, boolean success, Double responseTime) {
        synchronized (lock) {
            ActiveTask task = activeTasks.remove(taskId);
            if (task == null) return false;
            updateHealthLocked(task.providerId(), success, responseTime);
            if (responseTime != null) {
                baselineLatency.merge(task.providerId(), responseTime,
                        (old, sample) -> properties.getEmaAlpha() * sample + (1 - properties.getEmaAlpha()) * old);
            }
            decrementLoad(task.providerId());
            log.debug("[ROUTER] Task {} completed on {} (success={})", taskId, task.providerId(), success);
            return true;
        }
    }

    public Optional<String> providerFor(String taskId) {
        synchronized (lock) {
            ActiveTask task = activeTasks.get(taskId);
            return task == null ? Optional.empty() : Optional.of(task.providerId());
        }
    }

    public ProviderHealth providerHealth(String providerId) {
        synchronized (lock) {
            return healthOf(providerId);
        }
    }

    public Optional<Double> baselineLatency(String providerId) {
        synchronized (lock) {
            return Optional.ofNullable(baselineLatency.get(providerId));
        }
    }

    public RoutingStats routingStats() {
        synchronized (lock) {
            int healthy = (int) health.values().stream().filter(h -> h.status() == ProviderStatus.HEALTHY).count();
            return RoutingStats.builder()
                    .activeTasks(activeTasks.size())
                    .providerLoad(Map.copyOf(providerLoad))
                    .providerHealth(new LinkedHashMap<>(health))
                    .totalProvidersTracked(health.size())
                    .healthyProviders(healthy)
                    .build();
        }
    }

    private boolean isUsable(String providerId) {
        synchronized (lock) {
            return healthOf(providerId).status().isUsable();
        }
    }

    private boolean hasCapacity(String providerId) {
        synchronized (lock) {
            return providerLoad.getOrDefault(providerId, 0) < properties.getMaxProviderLoad();
        }
    }

    /** Unknown providers are HEALTHY until observed otherwise. */
    private ProviderHealth healthOf(String providerId) {
        ProviderHealth h = health.get(providerId);
        return h != null ? h : ProviderHealth.initial(providerId, clock.instant());
    }

    private void incrementLoad(String providerId) {
        providerLoad.merge(providerId, 1, Integer::sum);
    }

    private void decrementLoad(String providerId) {
        providerLoad.computeIfPresent(providerId, (k, v) -> Math.max(0, v - 1));
    }
}
