package com.di.taskpilot.audit;

import com.di.taskpilot.util.RingBuffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Slf4j
@Service
@ConditionalOnProperty(name = "taskpilot.metrics.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class LoggingAuditService implements AuditService {

    static final int WINDOW = 200;

    private final RingBuffer<AuditEvent> recent = new RingBuffer<>(WINDOW);

    @Override
    public void save(AuditEvent event) {
        log.info("[AUDIT] actor={} action={} resource={} result={} provider={} details={}",
                event.getActor(), event.getAction(), event.getResource(), event.getResult(),
                event.getProviderId(), event.getDetails());
        synchronized (recent) {
            recent.add(event);
        }
    }

    @Override
    public List<AuditEvent> findRecent(int limit) {
        int safeLimit = Math.min(Math.max(1, limit), 500);
        List<AuditEvent> out;
        synchronized (recent) {
            out = new ArrayList<>(recent.lastN(safeLimit));
        }
        Collections.reverse(out);
        return out;
    }
}
