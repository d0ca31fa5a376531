package com.di.taskpilot.router;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class RoutingStats {
    int activeTasks;
    Map<String, Integer> providerLoad;
    Map<String, ProviderHealth> providerHealth;
    int totalProvidersTracked;
    int healthyProviders;
}
