package com.di.taskpilot.router;

import com.di.taskpilot.learner.ResourceProfile;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RoutingDecision {
    String taskId;
    String providerId;
    /** Primary first; never empty, no duplicates. */
    List<String> fallbackChain;
    String reason;
    double confidence;
    /** Learned resource averages; only set when routed from a learned pattern. */
    ResourceProfile estimatedResources;
}
