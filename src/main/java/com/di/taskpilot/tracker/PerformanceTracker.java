package com.di.taskpilot.tracker;

import com.di.taskpilot.metrics.MetricQuery;
import com.di.taskpilot.metrics.MetricRecord;
import com.di.taskpilot.metrics.MetricsStore;
import com.di.taskpilot.resource.ResourceMonitor;
import com.di.taskpilot.resource.ResourceSample;
import com.di.taskpilot.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns per-task timings and resource readings into history, trends, degradation alerts and rankings.
 * <p>
 * Records are buffered and flushed to the {@link MetricsStore} in batches; a failed flush keeps the batch for the
 * next attempt. Unflushed records are visible to every query.
 */
@Slf4j
@Lazy
@Component
public class PerformanceTracker {

    private static final double SLOPE_THRESHOLD = 0.01;
    private static final int RECENT_SAMPLES = 10;
    /** Degradation fits the recent samples together with the same number preceding them. */
    private static final int DEGRADATION_TREND_SAMPLES = 2 * RECENT_SAMPLES;
    private static final int BASELINE_SAMPLES = 100;
    private static final double TREND_CONFIDENCE = 0.7;
    private static final double ERROR_RATE_ALERT = 0.2;
    private static final double ERROR_RATE_CRITICAL = 0.5;
    private static final double CPU_ALERT = 0.75;
    private static final double CPU_ALERT_HIGH = 0.85;
    private static final double RAM_ALERT = 0.70;
    private static final double RAM_ALERT_HIGH = 0.80;
    public static final double DEFAULT_DEGRADATION_THRESHOLD = 0.2;

    private final MetricsStore store;
    private final ResourceMonitor monitor;
    private final TrackerProperties properties;
    private final MetricsCollector metrics;
    private final Clock clock;

    private final Map<String, Instant> startTimes = new ConcurrentHashMap<>();
    private final Map<String, String> providerByTask = new ConcurrentHashMap<>();
    private final Map<String, Long> completionsByProvider = new HashMap<>();
    private final Map<String, Long> errorsByProvider = new HashMap<>();
    private final Object countersLock = new Object();
    private Instant throughputWindowStart;
    private long completedInWindow;

    private final List<MetricRecord> buffer = new ArrayList<>();
    private final Object flushLock = new Object();

    public PerformanceTracker(MetricsStore store, ResourceMonitor monitor, TrackerProperties properties,
                              MetricsCollector metrics, Clock clock) {
        this.store = store;
        this.monitor = monitor;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.throughputWindowStart = clock.instant();
        log.info("[TRACKER] Initialized (buffer={}, trendWindow={})", properties.getBufferSize(), properties.getTrendWindow());
    }

    // ------------------------------------------------------------------ //
    // Timing and collection                                               //
    // ------------------------------------------------------------------ //

    public void startTiming(String taskId) {
        startTimes.put(taskId, clock.instant());
        log.debug("[TRACKER] Started timing {}", taskId);
    }

    /** Starts timing and attributes the task's outcome to {@code providerId}. */
    public void startTiming(String taskId, String providerId) {
        if (providerId != null) providerByTask.put(taskId, providerId);
        startTiming(taskId);
    }

    public MetricRecord collectMetrics(String taskId, String providerId) {
        return collectMetrics(taskId, providerId, Map.of());
    }

    /**
     * Builds a record from the task's elapsed time, current host load and the provider's running counters,
     * then buffers it.
     */
    public MetricRecord collectMetrics(String taskId, String providerId, Map<String, Object> metadata) {
        Instant now = clock.instant();
        Instant start = startTimes.get(taskId);
        double latency = start == null ? 0.0 : Duration.between(start, now).toNanos() / 1e9;
        ResourceSample sample = monitor.sample();
        providerByTask.put(taskId, providerId);

        MetricRecord record = MetricRecord.builder()
                .taskId(taskId)
                .providerId(providerId)
                .timestamp(now)
                .latency(latency)
                .cpuUsage(sample.cpuPercent() / 100.0)
                .ramUsage(sample.memPercent() / 100.0)
                .throughput(throughput(now))
                .errorRate(errorRate(providerId))
                .queueDepth(startTimes.size())
                .metadata(metadata != null ? Map.copyOf(metadata) : Map.of())
                .build();
        recordMetrics(record);
        return record;
    }

    /** Buffers an externally observed record. */
    public void recordMetrics(MetricRecord record) {
        if (record == null || record.getProviderId() == null) return;
        boolean full;
        synchronized (buffer) {
            buffer.add(record);
            int overflow = buffer.size() - Math.max(properties.getBufferSize(), properties.getMaxBufferedRecords());
            if (overflow > 0) {
                buffer.subList(0, overflow).clear();
                log.warn("[TRACKER] Buffer over capacity; dropped {} oldest record(s)", overflow);
            }
            full = buffer.size() >= properties.getBufferSize();
        }
        if (full) {
            flush();
        }
    }

    /**
     * Ends timing. Unknown task ids are logged and ignored.
     */
    public void endTiming(String taskId, boolean success) {
        Instant start = startTimes.remove(taskId);
        if (start == null) {
            log.warn("[TRACKER] endTiming for unknown task {}", taskId);
            return;
        }
        String providerId = providerByTask.getOrDefault(taskId, "unknown");
        providerByTask.remove(taskId);
        synchronized (countersLock) {
            if (success) {
                completionsByProvider.merge(providerId, 1L, Long::sum);
                completedInWindow++;
            } else {
                errorsByProvider.merge(providerId, 1L, Long::sum);
            }
        }
        log.debug("[TRACKER] Ended {} on {} after {}ms (success={})", taskId, providerId,
                Duration.between(start, clock.instant()).toMillis(), success);
    }

    public boolean isTiming(String taskId) {
        return startTimes.containsKey(taskId);
    }

    private double throughput(Instant now) {
        synchronized (countersLock) {
            double seconds = Duration.between(throughputWindowStart, now).toNanos() / 1e9;
            if (seconds <= 0) return 0.0;
            double value = completedInWindow / seconds;
            if (Duration.between(throughputWindowStart, now).compareTo(properties.getThroughputWindow()) > 0) {
                throughputWindowStart = now;
                completedInWindow = 0;
            }
            return value;
        }
    }

    private double errorRate(String providerId) {
        synchronized (countersLock) {
            long errors = errorsByProvider.getOrDefault(providerId, 0L);
            long total = errors + completionsByProvider.getOrDefault(providerId, 0L);
            return total == 0 ? 0.0 : (double) errors / total;
        }
    }

    /**
     * Writes buffered records to the store.
     *
     * @return false when the store rejected the batch; the records stay buffered
     */
    public boolean flush() {
        synchronized (flushLock) {
            List<MetricRecord> batch;
            synchronized (buffer) {
                if (buffer.isEmpty()) return true;
                batch = new ArrayList<>(buffer);
            }
            try {
                store.store(batch);
            } catch (RuntimeException e) {
                metrics.recordMetricsFlushFailure();
                log.warn("[STORE] Flush of {} record(s) failed, keeping them buffered: {}", batch.size(), e.getMessage());
                return false;
            }
            Set<MetricRecord> flushed = Collections.newSetFromMap(new IdentityHashMap<>());
            flushed.addAll(batch);
            synchronized (buffer) {
                buffer.removeIf(flushed::contains);
            }
            metrics.recordMetricsFlushed(batch.size());
            log.debug("[TRACKER] Flushed {} record(s)", batch.size());
            return true;
        }
    }

    public int bufferedCount() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    // ------------------------------------------------------------------ //
    // History and trends                                                  //
    // ------------------------------------------------------------------ //

    public List<MetricRecord> history(String providerId) {
        return history(providerId, properties.getDefaultWindowHours());
    }

    /**
     * Records in the window, newest first. A failing store yields the buffered records only.
     */
    public List<MetricRecord> history(String providerId, int windowHours) {
        return history(providerId, windowHours, MetricQuery.DEFAULT_LIMIT);
    }

    private List<MetricRecord> history(String providerId, int windowHours, int limit) {
        Instant start = clock.instant().minus(Duration.ofHours(windowHours)).truncatedTo(ChronoUnit.SECONDS);
        MetricQuery query = MetricQuery.builder().providerId(providerId).start(start).limit(limit).build();

        List<MetricRecord> out = new ArrayList<>();
        synchronized (buffer) {
            for (int i = buffer.size() - 1; i >= 0; i--) {
                MetricRecord r = buffer.get(i);
                if (query.matches(r)) out.add(r);
            }
        }
        try {
            out.addAll(store.query(query));
        } catch (RuntimeException e) {
            log.warn("[STORE] History query failed, serving buffered records only: {}", e.getMessage());
        }
        out.sort(Comparator.comparing(MetricRecord::getTimestamp).reversed());
        return out.size() > limit ? new ArrayList<>(out.subList(0, limit)) : out;
    }

    public TrendAnalysis trend(String providerId, TrackedMetric metric) {
        return trend(providerId, metric, properties.getTrendWindow());
    }

    /**
     * OLS over the most recent {@code windowSize} values; INSUFFICIENT_DATA when fewer exist.
     */
    public TrendAnalysis trend(String providerId, TrackedMetric metric, int windowSize) {
        List<MetricRecord> newestFirst = history(providerId, properties.getDefaultWindowHours(), Math.max(1, windowSize));
        if (newestFirst.size() < windowSize) {
            return TrendAnalysis.insufficient(metric, newestFirst.size());
        }
        return fitTrend(chronological(newestFirst, windowSize), metric);
    }

    private static TrendAnalysis fitTrend(List<MetricRecord> chronological, TrackedMetric metric) {
        double[] values = chronological.stream().mapToDouble(metric::valueOf).toArray();
        LinearFit fit = LinearFit.of(values);
        return new TrendAnalysis(metric, fit.slope, direction(fit.slope, metric), fit.rSquared, values.length);
    }

    private static TrendDirection direction(double slope, TrackedMetric metric) {
        double worsening = metric.lowerIsBetter() ? slope : -slope;
        if (worsening > SLOPE_THRESHOLD) return TrendDirection.DEGRADING;
        if (worsening < -SLOPE_THRESHOLD) return TrendDirection.IMPROVING;
        return TrendDirection.STABLE;
    }

    /** The {@code count} newest records of a newest-first list, oldest first. */
    private static List<MetricRecord> chronological(List<MetricRecord> newestFirst, int count) {
        List<MetricRecord> out = new ArrayList<>(newestFirst.subList(0, Math.min(count, newestFirst.size())));
        Collections.reverse(out);
        return out;
    }

    // ------------------------------------------------------------------ //
    // Degradation                                                         //
    // ------------------------------------------------------------------ //

    public Optional<DegradationAlert> detectDegradation(String providerId) {
        return detectDegradation(providerId, DEFAULT_DEGRADATION_THRESHOLD);
    }

    /**
     * Most significant alert for the provider, checked in order latency, error rate, CPU, RAM.
     */
    public Optional<DegradationAlert> detectDegradation(String providerId, double threshold) {
        List<DegradationAlert> alerts = detectDegradations(providerId, threshold);
        return alerts.isEmpty() ? Optional.empty() : Optional.of(alerts.get(0));
    }

    /**
     * Every alert for the provider.
     * <ul>
     *   <li>latency: fit over the last 20 samples has positive slope with R-squared above 0.7, and the mean of the
     *       last 10 exceeds the mean of up to 100 preceding samples by more than {@code threshold}</li>
     *   <li>error rate: mean of the last 10 above 0.2</li>
     *   <li>cpu / ram: mean of the last 10 above 0.75 / 0.70</li>
     * </ul>
     */
    public List<DegradationAlert> detectDegradations(String providerId, double threshold) {
        List<MetricRecord> history = history(providerId, properties.getDefaultWindowHours());
        return detectDegradations(providerId, history, threshold);
    }

    private List<DegradationAlert> detectDegradations(String providerId, List<MetricRecord> newestFirst, double threshold) {
        List<DegradationAlert> alerts = new ArrayList<>();
        Instant now = clock.instant();
        List<MetricRecord> recent = newestFirst.subList(0, Math.min(RECENT_SAMPLES, newestFirst.size()));

        if (newestFirst.size() >= DEGRADATION_TREND_SAMPLES) {
            TrendAnalysis trend = fitTrend(chronological(newestFirst, DEGRADATION_TREND_SAMPLES), TrackedMetric.LATENCY);
            List<MetricRecord> baselineWindow = newestFirst.subList(RECENT_SAMPLES,
                    Math.min(newestFirst.size(), RECENT_SAMPLES + BASELINE_SAMPLES));
            double recentAvg = mean(recent, TrackedMetric.LATENCY);
            double baselineAvg = mean(baselineWindow, TrackedMetric.LATENCY);
            if (trend.slope() > 0 && trend.confidence() > TREND_CONFIDENCE
                    && baselineAvg > 0 && recentAvg > baselineAvg * (1 + threshold)) {
                double increase = (recentAvg - baselineAvg) / baselineAvg;
                Map<String, Double> details = new LinkedHashMap<>();
                details.put("currentAvg", recentAvg);
                details.put("baselineAvg", baselineAvg);
                details.put("increasePercent", increase * 100.0);
                details.put("trendConfidence", trend.confidence());
                alerts.add(DegradationAlert.builder()
                        .providerId(providerId)
                        .metric(TrackedMetric.LATENCY)
                        .severity(increase > 1.5 * threshold ? AlertSeverity.HIGH : AlertSeverity.MEDIUM)
                        .description(String.format("latency up %.0f%% over baseline", increase * 100.0))
                        .details(details)
                        .detectedAt(now)
                        .build());
            }
        }

        if (recent.size() >= RECENT_SAMPLES) {
            double recentErrors = mean(recent, TrackedMetric.ERROR_RATE);
            if (recentErrors > ERROR_RATE_ALERT) {
                alerts.add(DegradationAlert.builder()
                        .providerId(providerId)
                        .metric(TrackedMetric.ERROR_RATE)
                        .severity(recentErrors > ERROR_RATE_CRITICAL ? AlertSeverity.CRITICAL : AlertSeverity.HIGH)
                        .description(String.format("error rate %.0f%%", recentErrors * 100.0))
                        .details(Map.of("currentErrorRate", recentErrors))
                        .detectedAt(now)
                        .build());
            }
        }

        if (!recent.isEmpty()) {
            double cpu = mean(recent, TrackedMetric.CPU_USAGE);
            if (cpu > CPU_ALERT) {
                alerts.add(resourceAlert(providerId, TrackedMetric.CPU_USAGE, cpu, CPU_ALERT, cpu > CPU_ALERT_HIGH, now));
            }
            double ram = mean(recent, TrackedMetric.RAM_USAGE);
            if (ram > RAM_ALERT) {
                alerts.add(resourceAlert(providerId, TrackedMetric.RAM_USAGE, ram, RAM_ALERT, ram > RAM_ALERT_HIGH, now));
            }
        }
        return alerts;
    }

    private static DegradationAlert resourceAlert(String providerId, TrackedMetric metric, double value,
                                                  double limit, boolean high, Instant now) {
        return DegradationAlert.builder()
                .providerId(providerId)
                .metric(metric)
                .severity(high ? AlertSeverity.HIGH : AlertSeverity.MEDIUM)
                .description(String.format("sustained %s %.0f%%", metric.name().toLowerCase(), value * 100.0))
                .details(Map.of("average", value, "threshold", limit))
                .detectedAt(now)
                .build();
    }

    /** Alerts for every provider seen in the default window. */
    public List<DegradationAlert> detectAllDegradations() {
        List<MetricRecord> all = history(null, properties.getDefaultWindowHours());
        Set<String> providers = new LinkedHashSet<>();
        for (MetricRecord r : all) providers.add(r.getProviderId());
        List<DegradationAlert> alerts = new ArrayList<>();
        for (String providerId : providers) {
            alerts.addAll(detectDegradations(providerId, DEFAULT_DEGRADATION_THRESHOLD));
        }
        if (!alerts.isEmpty()) {
            log.warn("[TRACKER] {} degradation alert(s) across {} provider(s)", alerts.size(), providers.size());
        }
        return alerts;
    }

    // ------------------------------------------------------------------ //
    // Rankings                                                            //
    // ------------------------------------------------------------------ //

    public List<ProviderRanking> rankings() {
        return rankings(TrackedMetric.LATENCY);
    }

    /**
     * Providers in the default window, best first. Throughput scores are negated so higher throughput ranks first.
     */
    public List<ProviderRanking> rankings(TrackedMetric metric) {
        Map<String, List<MetricRecord>> byProvider = new LinkedHashMap<>();
        for (MetricRecord r : history(null, properties.getDefaultWindowHours())) {
            byProvider.computeIfAbsent(r.getProviderId(), k -> new ArrayList<>()).add(r);
        }
        List<ProviderRanking> out = new ArrayList<>();
        for (Map.Entry<String, List<MetricRecord>> e : byProvider.entrySet()) {
            List<MetricRecord> records = e.getValue();
            double avg = mean(records, metric);
            TrendAnalysis trend = fitTrend(chronological(records, Math.min(records.size(), properties.getTrendWindow())), metric);
            out.add(ProviderRanking.builder()
                    .providerId(e.getKey())
                    .score(metric.lowerIsBetter() ? avg : -avg)
                    .samples(records.size())
                    .avgLatency(mean(records, TrackedMetric.LATENCY))
                    .avgErrorRate(mean(records, TrackedMetric.ERROR_RATE))
                    .avgThroughput(mean(records, TrackedMetric.THROUGHPUT))
                    .avgCpu(mean(records, TrackedMetric.CPU_USAGE))
                    .avgRam(mean(records, TrackedMetric.RAM_USAGE))
                    .trend(trend.direction())
                    .trendConfidence(trend.confidence())
                    .build());
        }
        out.sort(Comparator.comparingDouble(ProviderRanking::getScore).thenComparing(ProviderRanking::getProviderId));
        return out;
    }

    private static double mean(List<MetricRecord> records, TrackedMetric metric) {
        return records.stream().mapToDouble(metric::valueOf).average().orElse(0.0);
    }
}
