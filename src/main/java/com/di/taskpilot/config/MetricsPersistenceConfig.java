package com.di.taskpilot.config;

import com.di.taskpilot.metrics.MetricsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * SQLite data source for the metrics and audit tables, created only when persistence is enabled.
 * JDBC auto-configuration is excluded at the application level, so this is the only data source.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "taskpilot.metrics.persistence-enabled", havingValue = "true")
public class MetricsPersistenceConfig {

    private static final int BUSY_TIMEOUT_MILLIS = 5000;

    @Bean
    public DataSource metricsDataSource(MetricsProperties properties) {
        Path db = Path.of(properties.getDatabasePath()).toAbsolutePath();
        try {
            if (db.getParent() != null) Files.createDirectories(db.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create metrics database directory for " + db, e);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        SQLiteDataSource ds = new SQLiteDataSource(config);
        ds.setUrl("jdbc:sqlite:" + db);
        log.info("[STORE] Metrics persistence enabled: {}", db);
        return ds;
    }

    @Bean
    public JdbcTemplate metricsJdbcTemplate(DataSource metricsDataSource) {
        return new JdbcTemplate(metricsDataSource);
    }
}
