package com.di.taskpilot.controller;

import com.di.taskpilot.adaptation.AdaptationOrchestrator;
import com.di.taskpilot.adaptation.AdaptationStatus;
import com.di.taskpilot.audit.AuditEvent;
import com.di.taskpilot.audit.AuditTrail;
import com.di.taskpilot.controller.dto.RouteRequest;
import com.di.taskpilot.controller.dto.TriggerAdaptationRequest;
import com.di.taskpilot.learner.PatternInsights;
import com.di.taskpilot.learner.ProviderRecommendation;
import com.di.taskpilot.learner.ScoredPattern;
import com.di.taskpilot.router.AdaptationResult;
import com.di.taskpilot.router.ProviderHealth;
import com.di.taskpilot.router.RoutingDecision;
import com.di.taskpilot.router.RoutingStats;
import com.di.taskpilot.tracker.DegradationAlert;
import com.di.taskpilot.tracker.ProviderRanking;
import com.di.taskpilot.tracker.TrackedMetric;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Management API over the adaptation loop: status, learned patterns, rankings, health and the manual
 * trigger. Rejected adaptations come back as 200 with {@code success=false} and a reason code.
 */
@Slf4j
@RestController
@RequestMapping("/api/adaptation")
@RequiredArgsConstructor
public class AdaptationController {

    private final AdaptationOrchestrator orchestrator;
    private final AuditTrail auditTrail;

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AdaptationStatus> status() {
        return ResponseEntity.ok(orchestrator.status());
    }

    @PostMapping(value = "/monitoring/start", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AdaptationStatus> startMonitoring() {
        orchestrator.startMonitoring();
        return ResponseEntity.ok(orchestrator.status());
    }

    @PostMapping(value = "/monitoring/stop", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AdaptationStatus> stopMonitoring() {
        orchestrator.stopMonitoring();
        return ResponseEntity.ok(orchestrator.status());
    }

    /**
     * Patterns for one task kind, or every pattern when taskKind is omitted. Highest confidence first.
     */
    @GetMapping(value = "/patterns", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ScoredPattern>> patterns(@RequestParam(required = false) String taskKind) {
        if (taskKind == null || taskKind.isBlank()) {
            return ResponseEntity.ok(orchestrator.loadedComponents().learner().allPatterns());
        }
        return ResponseEntity.ok(orchestrator.recommendations(taskKind.trim()));
    }

    @GetMapping(value = "/recommendation", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProviderRecommendation> recommendation(@RequestParam String taskKind) {
        return orchestrator.loadedComponents().learner().recommend(taskKind.trim())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/insights", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PatternInsights> insights() {
        return ResponseEntity.ok(orchestrator.analyzePatterns());
    }

    /**
     * Example: GET /api/adaptation/rankings?metric=error_rate
     */
    @GetMapping(value = "/rankings", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ProviderRanking>> rankings(@RequestParam(defaultValue = "latency") String metric) {
        TrackedMetric tracked = TrackedMetric.fromName(metric);
        return ResponseEntity.ok(orchestrator.loadedComponents().tracker().rankings(tracked));
    }

    @GetMapping(value = "/degradations", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<DegradationAlert>> degradations() {
        return ResponseEntity.ok(orchestrator.detectDegradations());
    }

    @GetMapping(value = "/routing", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RoutingStats> routing() {
        return ResponseEntity.ok(orchestrator.loadedComponents().router().routingStats());
    }

    @GetMapping(value = "/providers/{providerId}/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProviderHealth> providerHealth(@PathVariable String providerId) {
        return ResponseEntity.ok(orchestrator.loadedComponents().router().providerHealth(providerId));
    }

    /**
     * @param limit max number of events (default 50, max 500)
     */
    @GetMapping(value = "/audit", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<AuditEvent>> audit(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(auditTrail.findRecent(limit));
    }

    @PostMapping(value = "/route", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RoutingDecision> route(@RequestBody RouteRequest request) {
        if (request.getTaskKind() == null || request.getTaskKind().isBlank()
                || request.getTaskId() == null || request.getTaskId().isBlank()) {
            throw new IllegalArgumentException("taskKind and taskId are required");
        }
        return ResponseEntity.ok(orchestrator.route(request.getTaskKind().trim(), request.getTaskId().trim()));
    }

    @PostMapping(value = "/trigger", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AdaptationResult> trigger(@RequestBody TriggerAdaptationRequest request) {
        if (request.getTaskId() == null || request.getTaskId().isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        String reason = request.getReason() != null && !request.getReason().isBlank() ? request.getReason() : "manual";
        log.info("[ADAPT] Manual trigger for {} (reason={}, alternative={})", request.getTaskId(), reason,
                request.getAlternativeProvider());
        return ResponseEntity.ok(orchestrator.triggerAdaptation(request.getTaskId().trim(), reason,
                request.getAlternativeProvider()));
    }
}
