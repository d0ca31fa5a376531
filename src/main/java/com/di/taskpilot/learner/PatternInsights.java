package com.di.taskpilot.learner;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PatternInsights {

    /** Confidence above 0.7 and success rate above 0.9. */
    List<ScoredPattern> highPerformers;
    /** At least 10 executions and success rate below 0.7. */
    List<ScoredPattern> underperformers;
    /** Null until an adaptation has been recorded. */
    AdaptationEffectiveness adaptationEffectiveness;

    public record AdaptationEffectiveness(int totalAdaptations, double successRate, List<String> recentReasons) {
    }
}
