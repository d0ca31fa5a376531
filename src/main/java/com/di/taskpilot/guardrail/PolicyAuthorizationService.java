package com.di.taskpilot.guardrail;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Checks operations against {@link AuthorizationProperties}: denied operations first, then the provider
 * allow-list.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyAuthorizationService implements AuthorizationService {

    private final AuthorizationProperties properties;

    @Override
    public AuthorizationDecision authorize(String operation, String providerId) {
        if (!properties.isEnforce()) {
            return AuthorizationDecision.allow();
        }
        if (operation != null && properties.getDeniedOperations().contains(operation)) {
            log.warn("[AUTHZ] Operation '{}' denied by policy", operation);
            return AuthorizationDecision.deny("operation_denied: " + operation);
        }
        if (providerId != null && !providerAllowed(providerId)) {
            log.warn("[AUTHZ] Provider '{}' not allowed for '{}'", providerId, operation);
            return AuthorizationDecision.deny("provider_not_allowed: " + providerId);
        }
        return AuthorizationDecision.allow();
    }

    private boolean providerAllowed(String providerId) {
        if (properties.getAllowedProviders().isEmpty()) return true;
        for (String entry : properties.getAllowedProviders()) {
            if (entry.endsWith("*")) {
                if (providerId.startsWith(entry.substring(0, entry.length() - 1))) return true;
            } else if (entry.equals(providerId)) {
                return true;
            }
        }
        return false;
    }
}
