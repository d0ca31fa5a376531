package com.di.taskpilot.learner;

import com.di.taskpilot.util.RingBuffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Learns a confidence-scored {@link Pattern} per (task kind, provider) from execution outcomes and turns the
 * patterns into provider recommendations and resource predictions.
 * <p>
 * Success rate and resource averages are exponential moving averages with weight {@value #ALPHA}. Every
 * mutation rewrites the knowledge snapshot; a store failure is logged and the in-memory model keeps serving.
 */
@Slf4j
@Lazy
@Component
public class ContextLearner {

    public static final double ALPHA = 0.3;
    static final int CONFIDENCE_CAP_EXECUTIONS = 20;
    static final double RECENCY_HALF_LIFE_DAYS = 30.0;
    private static final double SECONDS_PER_DAY = 86_400.0;

    private static final double HIGH_PERFORMER_CONFIDENCE = 0.7;
    private static final double HIGH_PERFORMER_SUCCESS = 0.9;
    private static final int UNDERPERFORMER_MIN_EXECUTIONS = 10;
    private static final double UNDERPERFORMER_SUCCESS = 0.7;
    private static final int RECENT_REASONS = 10;

    private final KnowledgeStore store;
    private final LearnerProperties properties;
    private final Clock clock;

    private final Object lock = new Object();
    private final Object saveLock = new Object();
    private final Map<String, Pattern> patterns = new LinkedHashMap<>();
    private final RingBuffer<AdaptationRecord> adaptationHistory;

    public ContextLearner(KnowledgeStore store, LearnerProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
        this.adaptationHistory = new RingBuffer<>(Math.max(1, properties.getAdaptationHistorySize()));
        load();
    }

    private void load() {
        KnowledgeSnapshot snapshot;
        try {
            snapshot = store.load();
        } catch (RuntimeException e) {
            log.error("[LEARNER] Knowledge load failed, starting empty: {}", e.getMessage(), e);
            return;
        }
        synchronized (lock) {
            patterns.putAll(snapshot.patterns());
            snapshot.adaptationHistory().forEach(adaptationHistory::add);
        }
        log.info("[LEARNER] Loaded {} pattern(s), {} adaptation record(s)",
                snapshot.patterns().size(), snapshot.adaptationHistory().size());
    }

    /**
     * Saves are serialized under {@link #saveLock} and snapshot inside it, so the stored document never goes
     * back to an older state than one already written.
     */
    private void persist() {
        synchronized (saveLock) {
            KnowledgeSnapshot snapshot;
            synchronized (lock) {
                snapshot = new KnowledgeSnapshot(new LinkedHashMap<>(patterns), adaptationHistory.toList(),
                        clock.instant());
            }
            try {
                store.save(snapshot);
            } catch (RuntimeException e) {
                log.error("[LEARNER] Knowledge save failed; keeping in-memory state: {}", e.getMessage());
            }
        }
    }

    // ------------------------------------------------------------------ //
    // Learning                                                            //
    // ------------------------------------------------------------------ //

    /**
     * Folds one execution outcome into the pair's pattern, creating it with a neutral prior on first sight.
     *
     * @param observation may be null when only the outcome is known
     */
    public Pattern recordExecution(String taskKind, String providerId, ExecutionObservation observation, boolean success) {
        Instant now = clock.instant();
        Pattern updated;
        synchronized (lock) {
            String key = Pattern.key(taskKind, providerId);
            Pattern current = patterns.getOrDefault(key, Pattern.create(taskKind, providerId, now));
            updated = current.record(observation, success, ALPHA, now);
            patterns.put(key, updated);
        }
        persist();
        log.debug("[LEARNER] {} on {}: success={} rate={} n={}", taskKind, providerId, success,
                String.format("%.3f", updated.successRate()), updated.executionCount());
        return updated;
    }

    /** Appends to the bounded adaptation history used by {@link #analyzePatterns()}. */
    public void recordAdaptation(String taskId, boolean success, String reason) {
        synchronized (lock) {
            adaptationHistory.add(new AdaptationRecord(taskId, success, reason, clock.instant()));
        }
        persist();
    }

    // ------------------------------------------------------------------ //
    // Scoring                                                             //
    // ------------------------------------------------------------------ //

    public double confidence(Pattern pattern) {
        return confidence(pattern, clock.instant());
    }

    /**
     * {@code 0.4 * min(n/20, 1) + 0.4 * successRate + 0.2 * 0.5^(days/30)}.
     */
    public static double confidence(Pattern pattern, Instant now) {
        double base = Math.min((double) pattern.executionCount() / CONFIDENCE_CAP_EXECUTIONS, 1.0);
        double days = pattern.lastUpdated() == null ? 0.0
                : Math.max(0.0, Duration.between(pattern.lastUpdated(), now).getSeconds() / SECONDS_PER_DAY);
        double recency = Math.pow(0.5, days / RECENCY_HALF_LIFE_DAYS);
        return base * 0.4 + pattern.successRate() * 0.4 + recency * 0.2;
    }

    /** Patterns for the kind, highest confidence first. */
    public List<ScoredPattern> patternsFor(String taskKind) {
        Instant now = clock.instant();
        List<ScoredPattern> out = new ArrayList<>();
        synchronized (lock) {
            for (Pattern p : patterns.values()) {
                if (p.taskKind().equals(taskKind)) out.add(new ScoredPattern(p, confidence(p, now)));
            }
        }
        out.sort(Comparator.comparingDouble(ScoredPattern::confidence).reversed());
        return out;
    }

    public List<ScoredPattern> allPatterns() {
        Instant now = clock.instant();
        List<ScoredPattern> out = new ArrayList<>();
        synchronized (lock) {
            for (Pattern p : patterns.values()) out.add(new ScoredPattern(p, confidence(p, now)));
        }
        out.sort(Comparator.comparingDouble(ScoredPattern::confidence).reversed());
        return out;
    }

    public Optional<Pattern> pattern(String taskKind, String providerId) {
        synchronized (lock) {
            return Optional.ofNullable(patterns.get(Pattern.key(taskKind, providerId)));
        }
    }

    // ------------------------------------------------------------------ //
    // Recommendations                                                     //
    // ------------------------------------------------------------------ //

    public Optional<ProviderRecommendation> recommend(String taskKind) {
        return recommend(taskKind, ResourceConstraints.NONE);
    }

    /**
     * Highest-confidence pattern for the kind that fits the constraints.
     */
    public Optional<ProviderRecommendation> recommend(String taskKind, ResourceConstraints constraints) {
        ResourceConstraints c = constraints != null ? constraints : ResourceConstraints.NONE;
        Optional<ScoredPattern> best = patternsFor(taskKind).stream()
                .filter(sp -> c.allows(sp.pattern().resourceProfile()))
                .findFirst();
        if (best.isEmpty()) {
            log.debug("[LEARNER] No recommendation for {}", taskKind);
            return Optional.empty();
        }
        ScoredPattern sp = best.get();
        Pattern p = sp.pattern();
        ProviderRecommendation rec = ProviderRecommendation.builder()
                .providerId(p.providerId())
                .confidence(sp.confidence())
                .reason(reasonFor(p, sp.confidence()))
                .resourceEstimate(p.resourceProfile())
                .successRate(p.successRate())
                .executionCount(p.executionCount())
                .build();
        log.info("[LEARNER] Recommend {} for {} (confidence {})", rec.getProviderId(), taskKind,
                String.format("%.2f", rec.getConfidence()));
        return Optional.of(rec);
    }

    static String reasonFor(Pattern p, double confidence) {
        String rate = String.format("%.1f%% success rate", p.successRate() * 100.0);
        if (confidence > 0.9) {
            return "High confidence based on " + p.executionCount() + " successful executions (" + rate + ")";
        } else if (confidence > 0.7) {
            return "Good track record with " + p.executionCount() + " executions (" + rate + ")";
        } else if (confidence > 0.5) {
            return "Moderate confidence from " + p.executionCount() + " executions (" + rate + ")";
        }
        return "Limited data (" + p.executionCount() + " executions, " + rate + ")";
    }

    /**
     * With a provider: that pattern's averages. Without: confidence-weighted averages across the kind's providers.
     */
    public Optional<ResourcePrediction> predictResourceNeeds(String taskKind, String providerId) {
        if (providerId != null) {
            return pattern(taskKind, providerId).map(p -> new ResourcePrediction(
                    p.resourceProfile().avgCpu(),
                    p.resourceProfile().avgRam(),
                    p.resourceProfile().avgDuration(),
                    confidence(p),
                    p.resourceProfile().sampleCount()));
        }
        List<ScoredPattern> scored = patternsFor(taskKind);
        if (scored.isEmpty()) return Optional.empty();
        double totalWeight = scored.stream().mapToDouble(ScoredPattern::confidence).sum();
        if (totalWeight <= 0) return Optional.empty();
        double cpu = 0.0, ram = 0.0, duration = 0.0;
        long samples = 0;
        for (ScoredPattern sp : scored) {
            ResourceProfile rp = sp.pattern().resourceProfile();
            cpu += rp.avgCpu() * sp.confidence();
            ram += rp.avgRam() * sp.confidence();
            duration += rp.avgDuration() * sp.confidence();
            samples += rp.sampleCount();
        }
        return Optional.of(new ResourcePrediction(cpu / totalWeight, ram / totalWeight, duration / totalWeight,
                totalWeight / scored.size(), samples));
    }

    // ------------------------------------------------------------------ //
    // Insights and maintenance                                            //
    // ------------------------------------------------------------------ //

    public PatternInsights analyzePatterns() {
        List<ScoredPattern> all = allPatterns();
        List<ScoredPattern> high = new ArrayList<>();
        List<ScoredPattern> under = new ArrayList<>();
        for (ScoredPattern sp : all) {
            Pattern p = sp.pattern();
            if (sp.confidence() > HIGH_PERFORMER_CONFIDENCE && p.successRate() > HIGH_PERFORMER_SUCCESS) {
                high.add(sp);
            }
            if (p.executionCount() >= UNDERPERFORMER_MIN_EXECUTIONS && p.successRate() < UNDERPERFORMER_SUCCESS) {
                under.add(sp);
            }
        }
        List<AdaptationRecord> history;
        synchronized (lock) {
            history = adaptationHistory.toList();
        }
        PatternInsights.AdaptationEffectiveness effectiveness = null;
        if (!history.isEmpty()) {
            long succeeded = history.stream().filter(AdaptationRecord::success).count();
            List<String> reasons = history.subList(Math.max(0, history.size() - RECENT_REASONS), history.size())
                    .stream().map(AdaptationRecord::reason).toList();
            effectiveness = new PatternInsights.AdaptationEffectiveness(
                    history.size(), (double) succeeded / history.size(), reasons);
        }
        return PatternInsights.builder()
                .highPerformers(high)
                .underperformers(under)
                .adaptationEffectiveness(effectiveness)
                .build();
    }

    public int forgetStale() {
        return forgetStale(properties.getStaleDays());
    }

    /**
     * Drops patterns whose last update is older than {@code maxAgeDays}.
     *
     * @return number of patterns removed
     */
    public int forgetStale(int maxAgeDays) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(maxAgeDays));
        int removed;
        synchronized (lock) {
            int before = patterns.size();
            patterns.values().removeIf(p -> p.lastUpdated() != null && p.lastUpdated().isBefore(cutoff));
            removed = before - patterns.size();
        }
        if (removed > 0) {
            persist();
            log.info("[LEARNER] Forgot {} stale pattern(s) older than {} day(s)", removed, maxAgeDays);
        }
        return removed;
    }

    public List<AdaptationRecord> adaptationHistory() {
        synchronized (lock) {
            return adaptationHistory.toList();
        }
    }
}
