package com.di.taskpilot.resource;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Binding for resource monitor tuning.
 *
 * <pre>
 * taskpilot:
 *   monitor:
 *     cache-ttl: 1s
 *     idle-timeout: 30s
 *     history-size: 60
 *     poll-interval:
 *       idle: 8s
 *       active: 4s
 *       alert: 2s
 *       critical: 1s
 * </pre>
 *
 * The CPU/RAM ceilings are not configurable; see {@link com.di.taskpilot.guardrail.SafetyLimits}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "taskpilot.monitor")
public class ResourceMonitorProperties {

    /** A sample younger than this is served from cache. */
    private Duration cacheTtl = Duration.ofSeconds(1);

    /** Sustained low usage for this long drops the state to IDLE. */
    private Duration idleTimeout = Duration.ofSeconds(30);

    /** Samples kept for trend smoothing. */
    private int historySize = 60;

    private PollInterval pollInterval = new PollInterval();

    @Data
    public static class PollInterval {
        private Duration idle = MonitorState.IDLE.defaultPollInterval();
        private Duration active = MonitorState.ACTIVE.defaultPollInterval();
        private Duration alert = MonitorState.ALERT.defaultPollInterval();
        private Duration critical = MonitorState.CRITICAL.defaultPollInterval();

        public Duration forState(MonitorState state) {
            return switch (state) {
                case IDLE -> idle;
                case ACTIVE -> active;
                case ALERT -> alert;
                case CRITICAL -> critical;
            };
        }
    }
}
