package com.di.taskpilot.metrics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@DisplayName("CachingMetricsStore Tests")
class CachingMetricsStoreTest {

    private MetricsStore delegate;
    private CachingMetricsStore store;

    @BeforeEach
    void setUp() {
        delegate = mock(MetricsStore.class);
        store = new CachingMetricsStore(delegate, new MetricsProperties());
    }

    private static MetricRecord record(String taskId) {
        return MetricRecord.builder().taskId(taskId).providerId("gpu").timestamp(Instant.EPOCH).build();
    }

    @Test
    @DisplayName("Should serve a repeated query from the cache")
    void testQuery_Cached() {
        MetricQuery query = MetricQuery.builder().providerId("gpu").build();
        when(delegate.query(any())).thenReturn(List.of(record("t1")));

        assertEquals(1, store.query(query).size());
        assertEquals(1, store.query(MetricQuery.builder().providerId("gpu").build()).size());

        verify(delegate, times(1)).query(any());
    }

    @Test
    @DisplayName("Should treat different filters as different cache entries")
    void testQuery_DistinctKeys() {
        when(delegate.query(any())).thenReturn(List.of());
        store.query(MetricQuery.builder().providerId("gpu").build());
        store.query(MetricQuery.builder().providerId("gpu").limit(5).build());
        verify(delegate, times(2)).query(any());
    }

    @Test
    @DisplayName("Should invalidate cached reads after a write")
    void testStore_Invalidates() {
        when(delegate.query(any())).thenReturn(List.of());
        when(delegate.findProviderSummary("gpu")).thenReturn(Optional.empty());
        MetricQuery query = MetricQuery.builder().build();

        store.query(query);
        store.findProviderSummary("gpu");
        store.store(List.of(record("t1")));
        store.query(query);
        store.findProviderSummary("gpu");

        verify(delegate).store(anyList());
        verify(delegate, times(2)).query(any());
        verify(delegate, times(2)).findProviderSummary("gpu");
    }

    @Test
    @DisplayName("Should not cache a read that overlapped a write")
    void testQuery_OverlappingWriteNotCached() {
        MetricQuery query = MetricQuery.builder().providerId("gpu").build();
        MetricRecord flushed = record("t1");
        when(delegate.query(any()))
                .thenAnswer(inv -> {
                    store.store(List.of(flushed));
                    return List.of();
                })
                .thenReturn(List.of(flushed));

        assertTrue(store.query(query).isEmpty());
        assertEquals(List.of(flushed), store.query(query));
        assertEquals(List.of(flushed), store.query(query));

        verify(delegate, times(2)).query(any());
    }

    @Test
    @DisplayName("Should not cache a summary read that overlapped a write")
    void testFindProviderSummary_OverlappingWriteNotCached() {
        ProviderSummary summary = ProviderSummary.builder().providerId("gpu").totalTasks(1).avgLatency(0.2).build();
        when(delegate.findProviderSummary("gpu"))
                .thenAnswer(inv -> {
                    store.store(List.of(record("t1")));
                    return Optional.empty();
                })
                .thenReturn(Optional.of(summary));

        assertTrue(store.findProviderSummary("gpu").isEmpty());
        assertEquals(Optional.of(summary), store.findProviderSummary("gpu"));
        assertEquals(Optional.of(summary), store.findProviderSummary("gpu"));

        verify(delegate, times(2)).findProviderSummary("gpu");
    }

    @Test
    @DisplayName("Should invalidate even when the delegate write fails")
    void testStore_FailureStillInvalidates() {
        when(delegate.query(any())).thenReturn(List.of());
        doThrow(new MetricsStoreException("boom", new RuntimeException()))
                .when(delegate).store(anyList());
        MetricQuery query = MetricQuery.builder().build();

        store.query(query);
        assertThrows(MetricsStoreException.class, () -> store.store(List.of(record("t1"))));
        store.query(query);

        verify(delegate, times(2)).query(any());
    }

    @Test
    @DisplayName("Should cache empty summary lookups and skip null ids")
    void testFindProviderSummary_Cached() {
        when(delegate.findProviderSummary("gpu")).thenReturn(Optional.empty());

        assertTrue(store.findProviderSummary("gpu").isEmpty());
        assertTrue(store.findProviderSummary("gpu").isEmpty());
        assertTrue(store.findProviderSummary(null).isEmpty());

        verify(delegate, times(1)).findProviderSummary("gpu");
        verify(delegate, never()).findProviderSummary(null);
    }

    @Test
    @DisplayName("Should invalidate after a retention sweep")
    void testDeleteOlderThan_Invalidates() {
        when(delegate.query(any())).thenReturn(List.of());
        when(delegate.deleteOlderThan(30)).thenReturn(4);
        MetricQuery query = MetricQuery.builder().build();

        store.query(query);
        assertEquals(4, store.deleteOlderThan(30));
        store.query(query);

        verify(delegate, times(2)).query(any());
    }
}
