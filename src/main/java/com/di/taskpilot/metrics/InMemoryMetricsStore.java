package com.di.taskpilot.metrics;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of MetricsStore. Suitable for single-node and testing.
 * When taskpilot.metrics.persistence-enabled=true, JdbcMetricsStore is used instead.
 */
@Component
@ConditionalOnProperty(name = "taskpilot.metrics.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryMetricsStore implements MetricsStore {

    private final Clock clock;
    private final List<MetricRecord> insertionOrder = new ArrayList<>();
    private final Map<String, ProviderSummary> summaries = new ConcurrentHashMap<>();

    public InMemoryMetricsStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void store(List<MetricRecord> records) {
        if (records == null || records.isEmpty()) return;
        synchronized (insertionOrder) {
            for (MetricRecord r : records) {
                if (r == null || r.getProviderId() == null) continue;
                insertionOrder.add(r);
                summaries.merge(r.getProviderId(), ProviderSummary.first(r), (old, ignored) -> old.plus(r));
            }
        }
    }

    @Override
    public List<MetricRecord> query(MetricQuery query) {
        List<MetricRecord> out = new ArrayList<>();
        synchronized (insertionOrder) {
            for (int i = insertionOrder.size() - 1; i >= 0; i--) {
                MetricRecord r = insertionOrder.get(i);
                if (query.matches(r)) out.add(r);
            }
        }
        // stable sort keeps later inserts first among equal timestamps
        out.sort(Comparator.comparing(MetricRecord::getTimestamp).reversed());
        return out.size() > query.getLimit() ? new ArrayList<>(out.subList(0, Math.max(0, query.getLimit()))) : out;
    }

    @Override
    public Optional<ProviderSummary> findProviderSummary(String providerId) {
        return providerId == null ? Optional.empty() : Optional.ofNullable(summaries.get(providerId));
    }

    @Override
    public List<ProviderSummary> findProviderSummaries() {
        List<ProviderSummary> out = new ArrayList<>(summaries.values());
        out.sort(Comparator.comparing(ProviderSummary::getProviderId));
        return out;
    }

    @Override
    public int deleteOlderThan(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        synchronized (insertionOrder) {
            int before = insertionOrder.size();
            insertionOrder.removeIf(r -> r.getTimestamp().isBefore(cutoff));
            return before - insertionOrder.size();
        }
    }

    @Override
    public MetricsStoreStats stats() {
        synchronized (insertionOrder) {
            Instant oldest = insertionOrder.stream().map(MetricRecord::getTimestamp).min(Comparator.naturalOrder()).orElse(null);
            Instant newest = insertionOrder.stream().map(MetricRecord::getTimestamp).max(Comparator.naturalOrder()).orElse(null);
            return new MetricsStoreStats(insertionOrder.size(), summaries.size(), oldest, newest, "memory");
        }
    }
}
