package com.di.taskpilot.guardrail;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Static operation/provider policy (taskpilot.authorization.*). With enforce=false every check passes.
 */
@Data
@Component
@ConfigurationProperties(prefix = "taskpilot.authorization")
public class AuthorizationProperties {

    private boolean enforce = false;

    /** Empty allows every provider. Entries ending in {@code *} match by prefix (e.g. {@code local_*}). */
    private List<String> allowedProviders = new ArrayList<>();

    private List<String> deniedOperations = new ArrayList<>();
}
