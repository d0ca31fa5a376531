package com.di.taskpilot.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One significant decision: a route, a switch, a degradation alert or a safety-gate rejection.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditEvent {

    /** Set by the store on read; 0 before persisting. */
    long id;
    String actor;
    String action;
    String resource;
    String result;
    String providerId;
    Map<String, Object> details;
    Instant createdAt;
}
