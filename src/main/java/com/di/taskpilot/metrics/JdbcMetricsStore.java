package com.di.taskpilot.metrics;

import com.di.taskpilot.sql.SqlQueriesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of MetricsStore backed by an embedded SQLite file (tables {@code metrics} and
 * {@code provider_summaries}). Enable with taskpilot.metrics.persistence-enabled=true.
 * <p>
 * Each batch is inserted together with its summary updates in one transaction; summary read-modify-write
 * is serialized on the store's own lock.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "taskpilot.metrics.persistence-enabled", havingValue = "true")
public class JdbcMetricsStore implements MetricsStore {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TransactionTemplate tx;
    private final Object writeLock = new Object();

    public JdbcMetricsStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, ObjectMapper objectMapper, Clock clock) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.tx = new TransactionTemplate(new DataSourceTransactionManager(jdbcTemplate.getDataSource()));
    }

    private final RowMapper<MetricRecord> metricRowMapper = (rs, rowNum) -> MetricRecord.builder()
            .taskId(rs.getString("task_id"))
            .providerId(rs.getString("provider_id"))
            .timestamp(Instant.ofEpochMilli(rs.getLong("ts_millis")))
            .latency(rs.getDouble("latency"))
            .cpuUsage(rs.getDouble("cpu_usage"))
            .ramUsage(rs.getDouble("ram_usage"))
            .throughput(rs.getDouble("throughput"))
            .errorRate(rs.getDouble("error_rate"))
            .queueDepth(rs.getInt("queue_depth"))
            .metadata(readMetadata(rs.getString("metadata")))
            .build();

    private static final RowMapper<ProviderSummary> SUMMARY_ROW_MAPPER = (rs, rowNum) -> ProviderSummary.builder()
            .providerId(rs.getString("provider_id"))
            .totalTasks(rs.getLong("total_tasks"))
            .avgLatency(rs.getDouble("avg_latency"))
            .avgCpu(rs.getDouble("avg_cpu"))
            .avgRam(rs.getDouble("avg_ram"))
            .errorRate(rs.getDouble("error_rate"))
            .lastUpdated(Instant.ofEpochMilli(rs.getLong("last_updated_millis")))
            .build();

    @PostConstruct
    public void initSchema() {
        SqlQueriesProperties.Metrics q = sql.getMetrics();
        jdbc.execute(q.getCreateMetricsTable());
        jdbc.execute(q.getCreateProviderIndex());
        jdbc.execute(q.getCreateTaskIndex());
        jdbc.execute(q.getCreateSummaryTable());
        log.info("[STORE] Metrics schema ready");
    }

    @Override
    public void store(List<MetricRecord> records) {
        if (records == null || records.isEmpty()) return;
        SqlQueriesProperties.Metrics q = sql.getMetrics();
        synchronized (writeLock) {
            try {
                tx.executeWithoutResult(status -> {
                    Map<String, ProviderSummary> touched = new LinkedHashMap<>();
                    for (MetricRecord r : records) {
                        if (r == null || r.getProviderId() == null) continue;
                        jdbc.update(q.getInsertMetric(),
                                r.getTaskId(),
                                r.getProviderId(),
                                r.getTimestamp().toEpochMilli(),
                                r.getLatency(),
                                r.getCpuUsage(),
                                r.getRamUsage(),
                                r.getThroughput(),
                                r.getErrorRate(),
                                r.getQueueDepth(),
                                writeMetadata(r.getMetadata()));
                        ProviderSummary current = touched.containsKey(r.getProviderId())
                                ? touched.get(r.getProviderId())
                                : loadSummary(r.getProviderId()).orElse(null);
                        touched.put(r.getProviderId(), current == null ? ProviderSummary.first(r) : current.plus(r));
                    }
                    for (ProviderSummary s : touched.values()) {
                        jdbc.update(q.getUpsertSummary(),
                                s.getProviderId(),
                                s.getTotalTasks(),
                                s.getAvgLatency(),
                                s.getAvgCpu(),
                                s.getAvgRam(),
                                s.getErrorRate(),
                                s.getLastUpdated() != null ? s.getLastUpdated().toEpochMilli() : clock.millis());
                    }
                });
            } catch (DataAccessException e) {
                throw new MetricsStoreException("Failed to store " + records.size() + " metric record(s)", e);
            }
        }
    }

    @Override
    public List<MetricRecord> query(MetricQuery query) {
        SqlQueriesProperties.Metrics q = sql.getMetrics();
        StringBuilder statement = new StringBuilder(q.getQueryBase());
        List<Object> args = new ArrayList<>();
        if (query.getProviderId() != null) {
            statement.append(q.getFilterProvider());
            args.add(query.getProviderId());
        }
        if (query.getTaskId() != null) {
            statement.append(q.getFilterTask());
            args.add(query.getTaskId());
        }
        if (query.getStart() != null) {
            statement.append(q.getFilterStart());
            args.add(query.getStart().toEpochMilli());
        }
        if (query.getEnd() != null) {
            statement.append(q.getFilterEnd());
            args.add(query.getEnd().toEpochMilli());
        }
        statement.append(q.getOrderLimit());
        args.add(Math.max(1, query.getLimit()));
        try {
            return jdbc.query(statement.toString(), metricRowMapper, args.toArray());
        } catch (DataAccessException e) {
            throw new MetricsStoreException("Metric query failed", e);
        }
    }

    @Override
    public Optional<ProviderSummary> findProviderSummary(String providerId) {
        if (providerId == null) return Optional.empty();
        try {
            return loadSummary(providerId);
        } catch (DataAccessException e) {
            throw new MetricsStoreException("Summary lookup failed for " + providerId, e);
        }
    }

    private Optional<ProviderSummary> loadSummary(String providerId) {
        List<ProviderSummary> list = jdbc.query(sql.getMetrics().getFindSummary(), SUMMARY_ROW_MAPPER, providerId);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public List<ProviderSummary> findProviderSummaries() {
        try {
            return jdbc.query(sql.getMetrics().getFindAllSummaries(), SUMMARY_ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new MetricsStoreException("Summary listing failed", e);
        }
    }

    @Override
    public int deleteOlderThan(int days) {
        long cutoff = clock.instant().minus(Duration.ofDays(days)).toEpochMilli();
        synchronized (writeLock) {
            try {
                int deleted = jdbc.update(sql.getMetrics().getDeleteOlderThan(), cutoff);
                log.info("[STORE] Retention sweep removed {} record(s) older than {} day(s)", deleted, days);
                return deleted;
            } catch (DataAccessException e) {
                throw new MetricsStoreException("Retention sweep failed", e);
            }
        }
    }

    @Override
    public MetricsStoreStats stats() {
        try {
            Map<String, Object> row = jdbc.queryForMap(sql.getMetrics().getStats());
            Integer providers = jdbc.queryForObject(sql.getMetrics().getCountSummaries(), Integer.class);
            return new MetricsStoreStats(
                    toLong(row.get("total")),
                    providers != null ? providers : 0,
                    toInstant(row.get("oldest")),
                    toInstant(row.get("newest")),
                    "sqlite");
        } catch (DataAccessException e) {
            throw new MetricsStoreException("Stats query failed", e);
        }
    }

    private static long toLong(Object o) {
        return o instanceof Number n ? n.longValue() : 0L;
    }

    private static Instant toInstant(Object o) {
        return o instanceof Number n ? Instant.ofEpochMilli(n.longValue()) : null;
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("[STORE] Dropping unserializable metadata: {}", e.getMessage());
            return null;
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[STORE] Unreadable metadata ignored: {}", e.getMessage());
            return new HashMap<>();
        }
    }
}
