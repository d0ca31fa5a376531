package com.di.taskpilot.metrics;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * <pre>
 * taskpilot:
 *   metrics:
 *     persistence-enabled: false
 *     database-path: ./data/taskpilot-metrics.db
 *     retention-days: 30
 *     cache-enabled: true
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "taskpilot.metrics")
public class MetricsProperties {

    /** false = in-memory stores; true = SQLite through JDBC. */
    private boolean persistenceEnabled = false;

    private String databasePath = "./data/taskpilot-metrics.db";

    /** Records older than this are removed by the retention sweep. */
    private int retentionDays = 30;

    /** Caffeine cache in front of the JDBC store (persistence only). */
    private boolean cacheEnabled = true;
    private int cacheMaxSize = 500;
    private int cacheExpireAfterWriteSeconds = 30;
}
