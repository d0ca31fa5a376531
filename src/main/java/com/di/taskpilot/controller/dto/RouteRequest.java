package com.di.taskpilot.controller.dto;

import lombok.Data;

@Data
public class RouteRequest {
    private String taskKind;
    private String taskId;
}
