package com.di.taskpilot.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LoggingAuditService Tests")
class LoggingAuditServiceTest {

    private static AuditEvent event(String resource) {
        return AuditEvent.builder().actor("taskpilot").action("route").resource(resource)
                .createdAt(Instant.EPOCH).build();
    }

    @Test
    @DisplayName("Should return recent events newest first")
    void testFindRecent_NewestFirst() {
        LoggingAuditService service = new LoggingAuditService();
        service.save(event("t1"));
        service.save(event("t2"));
        service.save(event("t3"));

        List<AuditEvent> recent = service.findRecent(2);

        assertEquals(List.of("t3", "t2"), recent.stream().map(AuditEvent::getResource).toList());
        assertEquals(1, service.findRecent(0).size());
    }

    @Test
    @DisplayName("Should keep only the most recent window of events")
    void testSave_Windowed() {
        LoggingAuditService service = new LoggingAuditService();
        for (int i = 0; i < LoggingAuditService.WINDOW + 20; i++) service.save(event("t" + i));

        List<AuditEvent> recent = service.findRecent(500);

        assertEquals(LoggingAuditService.WINDOW, recent.size());
        assertEquals("t" + (LoggingAuditService.WINDOW + 19), recent.get(0).getResource());
    }
}
