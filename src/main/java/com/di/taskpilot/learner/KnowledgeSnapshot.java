package com.di.taskpilot.learner;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Whole-document persisted form of the learner: patterns keyed by {@code taskKind:providerId}
 * plus the recent adaptation history.
 */
public record KnowledgeSnapshot(Map<String, Pattern> patterns, List<AdaptationRecord> adaptationHistory, Instant lastSaved) {

    public static KnowledgeSnapshot empty() {
        return new KnowledgeSnapshot(Map.of(), List.of(), null);
    }

    public Map<String, Pattern> patterns() {
        return patterns != null ? patterns : Map.of();
    }

    public List<AdaptationRecord> adaptationHistory() {
        return adaptationHistory != null ? adaptationHistory : List.of();
    }
}
