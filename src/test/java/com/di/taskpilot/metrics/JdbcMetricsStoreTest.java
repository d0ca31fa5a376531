package com.di.taskpilot.metrics;

import com.di.taskpilot.sql.SqlQueriesProperties;
import com.di.taskpilot.testsupport.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JdbcMetricsStore Tests")
class JdbcMetricsStoreTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private JdbcTemplate jdbcTemplate;
    private JdbcMetricsStore store;

    @BeforeEach
    void setUp() {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("metrics.db"));
        jdbcTemplate = new JdbcTemplate(dataSource);
        clock = MutableClock.atEpoch();
        store = new JdbcMetricsStore(jdbcTemplate, new SqlQueriesProperties(), new ObjectMapper().findAndRegisterModules(), clock);
        store.initSchema();
    }

    private MetricRecord record(String taskId, String providerId, Instant ts, double latency) {
        return MetricRecord.builder()
                .taskId(taskId)
                .providerId(providerId)
                .timestamp(ts)
                .latency(latency)
                .cpuUsage(0.4)
                .ramUsage(0.2)
                .throughput(1.5)
                .errorRate(0.1)
                .queueDepth(3)
                .build();
    }

    // ============================================
    // Insert and query
    // ============================================

    @Test
    @DisplayName("Should persist every field including metadata")
    void testStore_RoundTripFields() {
        Instant t = clock.instant();
        store.store(List.of(record("t1", "gpu", t, 2.5).toBuilder().metadata(Map.of("attempt", 2)).build()));

        List<MetricRecord> out = store.query(MetricQuery.builder().taskId("t1").build());
        assertEquals(1, out.size());
        MetricRecord r = out.get(0);
        assertEquals("gpu", r.getProviderId());
        assertEquals(t, r.getTimestamp());
        assertEquals(2.5, r.getLatency(), 1e-9);
        assertEquals(0.4, r.getCpuUsage(), 1e-9);
        assertEquals(3, r.getQueueDepth());
        assertEquals(2, r.getMetadata().get("attempt"));
    }

    @Test
    @DisplayName("Should filter by provider and time window, newest first")
    void testQuery_Filters() {
        Instant t = clock.instant();
        store.store(List.of(
                record("t1", "gpu", t, 1.0),
                record("t2", "cpu", t.plusSeconds(1), 1.0),
                record("t3", "gpu", t.plusSeconds(2), 1.0),
                record("t4", "gpu", t.plusSeconds(3), 1.0)));

        assertEquals(List.of("t4", "t3", "t1"), store.query(MetricQuery.builder().providerId("gpu").build())
                .stream().map(MetricRecord::getTaskId).toList());
        assertEquals(List.of("t3", "t2"), store.query(MetricQuery.builder()
                        .start(t.plusSeconds(1)).end(t.plusSeconds(2)).build())
                .stream().map(MetricRecord::getTaskId).toList());
        assertEquals(1, store.query(MetricQuery.builder().limit(1).build()).size());
    }

    // ============================================
    // Summaries
    // ============================================

    @Test
    @DisplayName("Should maintain provider summaries across batches")
    void testSummary_AcrossBatches() {
        Instant t = clock.instant();
        store.store(List.of(record("t1", "gpu", t, 1.0), record("t2", "gpu", t.plusSeconds(1), 3.0)));
        store.store(List.of(record("t3", "gpu", t.plusSeconds(2), 5.0), record("t4", "cpu", t, 1.0)));

        ProviderSummary gpu = store.findProviderSummary("gpu").orElseThrow();
        assertEquals(3L, gpu.getTotalTasks());
        assertEquals(3.0, gpu.getAvgLatency(), 1e-9);
        assertEquals(t.plusSeconds(2), gpu.getLastUpdated());

        List<ProviderSummary> all = store.findProviderSummaries();
        assertEquals(List.of("cpu", "gpu"), all.stream().map(ProviderSummary::getProviderId).toList());
        assertTrue(store.findProviderSummary("missing").isEmpty());
    }

    // ============================================
    // Retention, stats, failures
    // ============================================

    @Test
    @DisplayName("Should remove records older than the retention window and report stats")
    void testDeleteOlderThan_AndStats() {
        Instant t = clock.instant();
        store.store(List.of(record("old", "gpu", t, 1.0), record("new", "gpu", t.plus(Duration.ofDays(5)), 1.0)));
        clock.advance(Duration.ofDays(6));

        assertEquals(1, store.deleteOlderThan(3));

        MetricsStoreStats stats = store.stats();
        assertEquals(1, stats.totalRecords());
        assertEquals(1, stats.providerCount());
        assertEquals(t.plus(Duration.ofDays(5)), stats.oldestRecord());
        assertEquals("sqlite", stats.backend());
    }

    @Test
    @DisplayName("Should wrap database errors in MetricsStoreException")
    void testStore_WrapsDataAccessErrors() {
        jdbcTemplate.execute("DROP TABLE metrics");
        MetricsStoreException ex = assertThrows(MetricsStoreException.class,
                () -> store.store(List.of(record("t1", "gpu", clock.instant(), 1.0))));
        assertNotNull(ex.getCause());
        assertThrows(MetricsStoreException.class, () -> store.query(MetricQuery.builder().build()));
    }
}
