package com.di.taskpilot.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Named SQL for the JDBC stores (taskpilot.sql.*). Defaults target SQLite and can be overridden in YAML.
 * No SQL is hardcoded in JDBC store classes; they use these named queries.
 */
@Component
@ConfigurationProperties(prefix = "taskpilot.sql")
public class SqlQueriesProperties {

    private Metrics metrics = new Metrics();
    private Audit audit = new Audit();

    public Metrics getMetrics() { return metrics; }
    public void setMetrics(Metrics metrics) { this.metrics = metrics; }
    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }

    public static class Metrics {
        private String createMetricsTable = "CREATE TABLE IF NOT EXISTS metrics ("
                + "id INTEGER PRIMARY KEY AUTOINCREMENT, task_id TEXT NOT NULL, provider_id TEXT NOT NULL, "
                + "ts_millis INTEGER NOT NULL, latency REAL, cpu_usage REAL, ram_usage REAL, throughput REAL, "
                + "error_rate REAL, queue_depth INTEGER, metadata TEXT)";
        private String createProviderIndex = "CREATE INDEX IF NOT EXISTS idx_metrics_provider_ts ON metrics(provider_id, ts_millis)";
        private String createTaskIndex = "CREATE INDEX IF NOT EXISTS idx_metrics_task ON metrics(task_id)";
        private String createSummaryTable = "CREATE TABLE IF NOT EXISTS provider_summaries ("
                + "provider_id TEXT PRIMARY KEY, total_tasks INTEGER NOT NULL, avg_latency REAL, avg_cpu REAL, "
                + "avg_ram REAL, error_rate REAL, last_updated_millis INTEGER)";
        private String insertMetric = "INSERT INTO metrics (task_id, provider_id, ts_millis, latency, cpu_usage, ram_usage, "
                + "throughput, error_rate, queue_depth, metadata) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        private String queryBase = "SELECT task_id, provider_id, ts_millis, latency, cpu_usage, ram_usage, throughput, "
                + "error_rate, queue_depth, metadata FROM metrics WHERE 1=1";
        private String filterProvider = " AND provider_id = ?";
        private String filterTask = " AND task_id = ?";
        private String filterStart = " AND ts_millis >= ?";
        private String filterEnd = " AND ts_millis <= ?";
        private String orderLimit = " ORDER BY ts_millis DESC, id DESC LIMIT ?";
        private String findSummary = "SELECT provider_id, total_tasks, avg_latency, avg_cpu, avg_ram, error_rate, "
                + "last_updated_millis FROM provider_summaries WHERE provider_id = ?";
        private String findAllSummaries = "SELECT provider_id, total_tasks, avg_latency, avg_cpu, avg_ram, error_rate, "
                + "last_updated_millis FROM provider_summaries ORDER BY provider_id";
        private String upsertSummary = "INSERT OR REPLACE INTO provider_summaries (provider_id, total_tasks, avg_latency, "
                + "avg_cpu, avg_ram, error_rate, last_updated_millis) VALUES (?, ?, ?, ?, ?, ?, ?)";
        private String deleteOlderThan = "DELETE FROM metrics WHERE ts_millis < ?";
        private String stats = "SELECT COUNT(*) AS total, MIN(ts_millis) AS oldest, MAX(ts_millis) AS newest FROM metrics";
        private String countSummaries = "SELECT COUNT(*) FROM provider_summaries";

        public String getCreateMetricsTable() { return createMetricsTable; }
        public void setCreateMetricsTable(String createMetricsTable) { this.createMetricsTable = createMetricsTable; }
        public String getCreateProviderIndex() { return createProviderIndex; }
        public void setCreateProviderIndex(String createProviderIndex) { this.createProviderIndex = createProviderIndex; }
        public String getCreateTaskIndex() { return createTaskIndex; }
        public void setCreateTaskIndex(String createTaskIndex) { this.createTaskIndex = createTaskIndex; }
        public String getCreateSummaryTable() { return createSummaryTable; }
        public void setCreateSummaryTable(String createSummaryTable) { this.createSummaryTable = createSummaryTable; }
        public String getInsertMetric() { return insertMetric; }
        public void setInsertMetric(String insertMetric) { this.insertMetric = insertMetric; }
        public String getQueryBase() { return queryBase; }
        public void setQueryBase(String queryBase) { this.queryBase = queryBase; }
        public String getFilterProvider() { return filterProvider; }
        public void setFilterProvider(String filterProvider) { this.filterProvider = filterProvider; }
        public String getFilterTask() { return filterTask; }
        public void setFilterTask(String filterTask) { this.filterTask = filterTask; }
        public String getFilterStart() { return filterStart; }
        public void setFilterStart(String filterStart) { this.filterStart = filterStart; }
        public String getFilterEnd() { return filterEnd; }
        public void setFilterEnd(String filterEnd) { this.filterEnd = filterEnd; }
        public String getOrderLimit() { return orderLimit; }
        public void setOrderLimit(String orderLimit) { this.orderLimit = orderLimit; }
        public String getFindSummary() { return findSummary; }
        public void setFindSummary(String findSummary) { this.findSummary = findSummary; }
        public String getFindAllSummaries() { return findAllSummaries; }
        public void setFindAllSummaries(String findAllSummaries) { this.findAllSummaries = findAllSummaries; }
        public String getUpsertSummary() { return upsertSummary; }
        public void setUpsertSummary(String upsertSummary) { this.upsertSummary = upsertSummary; }
        public String getDeleteOlderThan() { return deleteOlderThan; }
        public void setDeleteOlderThan(String deleteOlderThan) { this.deleteOlderThan = deleteOlderThan; }
        public String getStats() { return stats; }
        public void setStats(String stats) { this.stats = stats; }
        public String getCountSummaries() { return countSummaries; }
        public void setCountSummaries(String countSummaries) { this.countSummaries = countSummaries; }
    }

    public static class Audit {
        private String createTable = "CREATE TABLE IF NOT EXISTS audit_events ("
                + "id INTEGER PRIMARY KEY AUTOINCREMENT, actor TEXT NOT NULL, action TEXT NOT NULL, resource TEXT, "
                + "result TEXT NOT NULL, provider_id TEXT, details TEXT, created_at_millis INTEGER NOT NULL)";
        private String insert = "INSERT INTO audit_events (actor, action, resource, result, provider_id, details, created_at_millis) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?)";
        private String findRecent = "SELECT id, actor, action, resource, result, provider_id, details, created_at_millis "
                + "FROM audit_events ORDER BY id DESC LIMIT ?";

        public String getCreateTable() { return createTable; }
        public void setCreateTable(String createTable) { this.createTable = createTable; }
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindRecent() { return findRecent; }
        public void setFindRecent(String findRecent) { this.findRecent = findRecent; }
    }
}
