package com.di.taskpilot.audit;

import com.di.taskpilot.sql.SqlQueriesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit rows in the {@code audit_events} table of the metrics database.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "taskpilot.metrics.persistence-enabled", havingValue = "true")
public class JdbcAuditService implements AuditService {

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxDetailsLength;

    public JdbcAuditService(JdbcTemplate jdbcTemplate,
                            SqlQueriesProperties sql,
                            ObjectMapper objectMapper,
                            Clock clock,
                            @Value("${taskpilot.audit.max-details-length:4096}") int maxDetailsLength) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxDetailsLength = maxDetailsLength;
    }

    private final RowMapper<AuditEvent> rowMapper = (rs, rowNum) -> AuditEvent.builder()
            .id(rs.getLong("id"))
            .actor(rs.getString("actor"))
            .action(rs.getString("action"))
            .resource(rs.getString("resource"))
            .result(rs.getString("result"))
            .providerId(rs.getString("provider_id"))
            .details(readDetails(rs.getString("details")))
            .createdAt(Instant.ofEpochMilli(rs.getLong("created_at_millis")))
            .build();

    @PostConstruct
    public void initSchema() {
        jdbc.execute(sql.getAudit().getCreateTable());
    }

    @Override
    public void save(AuditEvent event) {
        Instant at = event.getCreatedAt() != null ? event.getCreatedAt() : clock.instant();
        try {
            jdbc.update(sql.getAudit().getInsert(),
                    event.getActor(),
                    event.getAction(),
                    event.getResource(),
                    event.getResult(),
                    event.getProviderId(),
                    truncate(writeDetails(event.getDetails()), maxDetailsLength),
                    at.toEpochMilli());
        } catch (Exception e) {
            // do not fail the caller if audit insert fails
            log.warn("[AUDIT] Failed to save {} event: {}", event.getAction(), e.getMessage());
        }
    }

    @Override
    public List<AuditEvent> findRecent(int limit) {
        int safeLimit = Math.min(Math.max(1, limit), 500);
        return jdbc.query(sql.getAudit().getFindRecent(), rowMapper, safeLimit);
    }

    private String writeDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("[AUDIT] Details not serializable, storing toString: {}", e.getMessage());
            return details.toString();
        }
    }

    private Map<String, Object> readDetails(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[AUDIT] Unreadable details column: {}", e.getMessage());
            return Map.of("raw", json);
        }
    }

    private static String truncate(String s, int maxLen) {
        if (s == null || s.length() <= maxLen) return s;
        return s.substring(0, maxLen) + "...";
    }
}
