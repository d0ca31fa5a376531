package com.di.taskpilot.controller.dto;

import lombok.Data;

/**
 * Body for POST /api/adaptation/trigger.
 */
@Data
public class TriggerAdaptationRequest {
    private String taskId;
    private String reason;
    /** Optional explicit target provider. */
    private String alternativeProvider;
}
