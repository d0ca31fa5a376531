package com.di.taskpilot.controller;

import com.di.taskpilot.adaptation.AdaptationComponents;
import com.di.taskpilot.adaptation.AdaptationOrchestrator;
import com.di.taskpilot.audit.AuditTrail;
import com.di.taskpilot.exception.GlobalExceptionHandler;
import com.di.taskpilot.learner.ContextLearner;
import com.di.taskpilot.router.AdaptationResult;
import com.di.taskpilot.router.AdaptiveRouter;
import com.di.taskpilot.router.RoutingDecision;
import com.di.taskpilot.tracker.PerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("AdaptationController Tests")
class AdaptationControllerTest {

    private static final Instant AT = Instant.parse("2026-03-01T10:00:00Z");

    private AdaptationOrchestrator orchestrator;
    private AuditTrail auditTrail;
    private ContextLearner learner;
    private PerformanceTracker tracker;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(AdaptationOrchestrator.class);
        auditTrail = mock(AuditTrail.class);
        learner = mock(ContextLearner.class);
        tracker = mock(PerformanceTracker.class);
        when(orchestrator.loadedComponents())
                .thenReturn(new AdaptationComponents(tracker, learner, mock(AdaptiveRouter.class)));
        mockMvc = MockMvcBuilders.standaloneSetup(new AdaptationController(orchestrator, auditTrail))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    // ============================================
    // Trigger and route
    // ============================================

    @Test
    @DisplayName("Should return a rejected adaptation as 200 with its reason code")
    void testTrigger_RejectedIsOk() throws Exception {
        when(orchestrator.triggerAdaptation("t1", "manual", null))
                .thenReturn(AdaptationResult.failure(AdaptationResult.RATE_LIMITED, Map.of("min_interval_seconds", 5), AT));

        mockMvc.perform(post("/api/adaptation/trigger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"taskId\":\"t1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.reason").value("rate_limited"))
                .andExpect(jsonPath("$.details.min_interval_seconds").value(5));
    }

    @Test
    @DisplayName("Should pass reason and alternative through to the orchestrator")
    void testTrigger_WithAlternative() throws Exception {
        when(orchestrator.triggerAdaptation("t1", "latency_spike", "gpu"))
                .thenReturn(AdaptationResult.success("switched_latency_spike", Map.of("new_provider", "gpu"), AT));

        mockMvc.perform(post("/api/adaptation/trigger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"taskId\":\"t1\",\"reason\":\"latency_spike\",\"alternativeProvider\":\"gpu\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.details.new_provider").value("gpu"));
    }

    @Test
    @DisplayName("Should reject a trigger without a task id")
    void testTrigger_MissingTaskId() throws Exception {
        mockMvc.perform(post("/api/adaptation/trigger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"manual\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.path").value("/api/adaptation/trigger"));
        verify(orchestrator, never()).triggerAdaptation(any(), any(), any());
    }

    @Test
    @DisplayName("Should route a task and return the decision")
    void testRoute() throws Exception {
        when(orchestrator.route("sim", "t1")).thenReturn(RoutingDecision.builder()
                .taskId("t1").providerId("local_cpu").fallbackChain(List.of("local_cpu"))
                .reason("default_fallback").confidence(0.3).build());

        mockMvc.perform(post("/api/adaptation/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"taskKind\":\" sim \",\"taskId\":\"t1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.providerId").value("local_cpu"))
                .andExpect(jsonPath("$.fallbackChain[0]").value("local_cpu"));
    }

    // ============================================
    // Queries
    // ============================================

    @Test
    @DisplayName("Should return 404 when no recommendation exists")
    void testRecommendation_NotFound() throws Exception {
        when(learner.recommend("sim")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/adaptation/recommendation").param("taskKind", "sim"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should return 400 when taskKind is missing")
    void testRecommendation_MissingParam() throws Exception {
        mockMvc.perform(get("/api/adaptation/recommendation"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should return 400 for an unknown ranking metric")
    void testRankings_UnknownMetric() throws Exception {
        mockMvc.perform(get("/api/adaptation/rankings").param("metric", "colour"))
                .andExpect(status().isBadRequest());
        verify(tracker, never()).rankings(any());
    }

    @Test
    @DisplayName("Should pass the audit limit through")
    void testAudit_Limit() throws Exception {
        when(auditTrail.findRecent(5)).thenReturn(List.of());

        mockMvc.perform(get("/api/adaptation/audit").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
        verify(auditTrail).findRecent(5);
    }

    @Test
    @DisplayName("Should list every pattern when no task kind is given")
    void testPatterns_All() throws Exception {
        when(learner.allPatterns()).thenReturn(List.of());

        mockMvc.perform(get("/api/adaptation/patterns"))
                .andExpect(status().isOk());
        verify(learner).allPatterns();
        verify(orchestrator, never()).recommendations(isNull());
    }
}
