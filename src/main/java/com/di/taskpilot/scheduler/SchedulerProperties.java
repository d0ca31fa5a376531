package com.di.taskpilot.scheduler;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * <pre>
 * taskpilot:
 *   scheduler:
 *     auto-start: true
 *     tick: 200ms
 *     max-concurrent: 3
 *     history-size: 100
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "taskpilot.scheduler")
public class SchedulerProperties {

    /** Start the monitor and the admission loop when the application is ready. */
    private boolean autoStart = true;

    /** Admission loop period. */
    private Duration tick = Duration.ofMillis(200);

    /** Concurrency ceiling with no throttling. */
    private int maxConcurrent = 3;

    /** Finished tasks kept for inspection. */
    private int historySize = 100;
}
