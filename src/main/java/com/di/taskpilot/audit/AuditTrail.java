package com.di.taskpilot.audit;

import com.di.taskpilot.util.DaemonThreadFactory;
import com.di.taskpilot.util.MdcPropagation;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget emission of audit events on one daemon thread. Callers never block on, or fail because
 * of, the underlying {@link AuditService}.
 */
@Slf4j
@Component
public class AuditTrail {

    public static final String ACTOR = "taskpilot";

    private final AuditService auditService;
    private final Clock clock;
    private final ExecutorService executor =
            Executors.newSingleThreadExecutor(new DaemonThreadFactory("taskpilot-audit"));

    public AuditTrail(AuditService auditService, Clock clock) {
        this.auditService = auditService;
        this.clock = clock;
    }

    public void emit(String action, String resource, String result, String providerId, Map<String, Object> details) {
        AuditEvent event = AuditEvent.builder()
                .actor(ACTOR)
                .action(action)
                .resource(resource)
                .result(result)
                .providerId(providerId)
                .details(details)
                .createdAt(clock.instant())
                .build();
        try {
            executor.execute(MdcPropagation.wrapRunnable(() -> save(event)));
        } catch (RejectedExecutionException e) {
            log.warn("[AUDIT] Dropped {} event after shutdown", action);
        }
    }

    private void save(AuditEvent event) {
        try {
            auditService.save(event);
        } catch (RuntimeException e) {
            log.warn("[AUDIT] Failed to emit {} event: {}", event.getAction(), e.getMessage());
        }
    }

    public List<AuditEvent> findRecent(int limit) {
        return auditService.findRecent(limit);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
