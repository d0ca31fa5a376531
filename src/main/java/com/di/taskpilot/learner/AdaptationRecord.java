package com.di.taskpilot.learner;

import java.time.Instant;

public record AdaptationRecord(String taskId, boolean success, String reason, Instant timestamp) {
}
