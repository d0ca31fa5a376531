package com.di.taskpilot.metrics;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of {@link MetricRecord}s plus a per-provider running aggregate.
 * Implementations serialize summary updates themselves; callers never read-modify-write a summary.
 */
public interface MetricsStore {

    /**
     * Appends the records and folds each into its provider's summary.
     *
     * @throws MetricsStoreException when the batch could not be written
     */
    void store(List<MetricRecord> records);

    /** Records matching the filter, newest first, at most {@code query.limit}. */
    List<MetricRecord> query(MetricQuery query);

    Optional<ProviderSummary> findProviderSummary(String providerId);

    List<ProviderSummary> findProviderSummaries();

    /**
     * Retention sweep.
     *
     * @return number of records deleted
     */
    int deleteOlderThan(int days);

    MetricsStoreStats stats();
}
