package com.di.taskpilot.metrics;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Cache in front of {@link JdbcMetricsStore}. Every write or retention sweep invalidates both caches,
 * so reads never miss data this process has stored. A read that overlapped a write is returned but not cached.
 * Disable with {@code taskpilot.metrics.cache-enabled=false}.
 */
@Service
@Primary
@ConditionalOnExpression("${taskpilot.metrics.persistence-enabled:false} and ${taskpilot.metrics.cache-enabled:true}")
public class CachingMetricsStore implements MetricsStore {

    private final MetricsStore delegate;
    private final Cache<String, List<MetricRecord>> queries;
    private final Cache<String, Optional<ProviderSummary>> summaries;
    private final Object writeLock = new Object();
    private long writeGeneration;

    @Autowired
    public CachingMetricsStore(JdbcMetricsStore delegate, MetricsProperties properties) {
        this((MetricsStore) delegate, properties);
    }

    CachingMetricsStore(MetricsStore delegate, MetricsProperties properties) {
        this.delegate = delegate;
        this.queries = Caffeine.newBuilder()
                .maximumSize(properties.getCacheMaxSize())
                .expireAfterWrite(properties.getCacheExpireAfterWriteSeconds(), TimeUnit.SECONDS)
                .build();
        this.summaries = Caffeine.newBuilder()
                .maximumSize(properties.getCacheMaxSize())
                .expireAfterWrite(properties.getCacheExpireAfterWriteSeconds(), TimeUnit.SECONDS)
                .build();
    }

    @Override
    public void store(List<MetricRecord> records) {
        try {
            delegate.store(records);
        } finally {
            invalidateAll();
        }
    }

    @Override
    public List<MetricRecord> query(MetricQuery query) {
        String key = query.key();
        List<MetricRecord> cached = queries.getIfPresent(key);
        if (cached != null) return cached;
        long generation = generation();
        List<MetricRecord> fromDb = List.copyOf(delegate.query(query));
        synchronized (writeLock) {
            if (generation == writeGeneration) queries.put(key, fromDb);
        }
        return fromDb;
    }

    @Override
    public Optional<ProviderSummary> findProviderSummary(String providerId) {
        if (providerId == null) return Optional.empty();
        Optional<ProviderSummary> cached = summaries.getIfPresent(providerId);
        if (cached != null) return cached;
        long generation = generation();
        Optional<ProviderSummary> fromDb = delegate.findProviderSummary(providerId);
        synchronized (writeLock) {
            if (generation == writeGeneration) summaries.put(providerId, fromDb);
        }
        return fromDb;
    }

    @Override
    public List<ProviderSummary> findProviderSummaries() {
        return delegate.findProviderSummaries();
    }

    @Override
    public int deleteOlderThan(int days) {
        try {
            return delegate.deleteOlderThan(days);
        } finally {
            invalidateAll();
        }
    }

    @Override
    public MetricsStoreStats stats() {
        return delegate.stats();
    }

    private long generation() {
        synchronized (writeLock) {
            return writeGeneration;
        }
    }

    private void invalidateAll() {
        synchronized (writeLock) {
            writeGeneration++;
            queries.invalidateAll();
            summaries.invalidateAll();
        }
    }
}
