package com.di.taskpilot.learner;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * <pre>
 * taskpilot:
 *   learner:
 *     store: file          # file | memory
 *     knowledge-file: ./data/knowledge.json
 *     adaptation-history-size: 100
 *     stale-days: 90
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "taskpilot.learner")
public class LearnerProperties {

    private String store = "file";

    private String knowledgeFile = "./data/knowledge.json";

    private int adaptationHistorySize = 100;

    /** Patterns not updated for this many days are dropped by the staleness sweep. */
    private int staleDays = 90;
}
