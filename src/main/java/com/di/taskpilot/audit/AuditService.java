package com.di.taskpilot.audit;

import java.util.List;

/**
 * Persists audit events. When persistence is disabled, events go to the log and a small in-memory window.
 */
public interface AuditService {

    void save(AuditEvent event);

    /** Newest first, at most {@code limit} (capped at 500). */
    List<AuditEvent> findRecent(int limit);
}
