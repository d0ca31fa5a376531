package com.di.taskpilot.guardrail;

/**
 * Capability check consulted before resource-consuming operations. A deny must leave core state untouched.
 */
public interface AuthorizationService {

    String OP_TRIGGER_ADAPTATION = "trigger_adaptation";
    String OP_MONITOR_EXECUTION = "monitor_execution";

    /**
     * @param providerId may be null when the operation is not provider-specific
     */
    AuthorizationDecision authorize(String operation, String providerId);
}
