package com.di.taskpilot.router;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "taskpilot.router")
public class RouterProperties {

    /** Last-resort provider; always terminates a fallback chain. */
    private String defaultProvider = "local_cpu";

    private int maxFallbackChain = 3;

    /** Providers at or above this many assigned tasks are skipped by ranking-based routing. */
    private int maxProviderLoad = 10;

    /** Current latency above this multiple of the provider baseline triggers a switch. */
    private double latencySpikeFactor = 3.0;

    private double errorRateThreshold = 0.2;

    /** Consecutive failures that take a provider OFFLINE. */
    private int maxConsecutiveFailures = 3;

    /** Learned patterns above this confidence route directly. */
    private double learnedConfidenceThreshold = 0.7;

    /** Learned patterns above this confidence are load-balancing candidates. */
    private double loadBalanceConfidenceThreshold = 0.5;

    /** EMA weight for response-time and baseline-latency updates. */
    private double emaAlpha = 0.3;
}
