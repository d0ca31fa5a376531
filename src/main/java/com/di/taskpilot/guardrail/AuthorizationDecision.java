package com.di.taskpilot.guardrail;

public record AuthorizationDecision(boolean allowed, String reason) {

    private static final AuthorizationDecision ALLOW = new AuthorizationDecision(true, null);

    public static AuthorizationDecision allow() {
        return ALLOW;
    }

    public static AuthorizationDecision deny(String reason) {
        return new AuthorizationDecision(false, reason);
    }
}
