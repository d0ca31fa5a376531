package com.di.taskpilot.learner;

/** A pattern with its confidence evaluated at query time. */
public record ScoredPattern(Pattern pattern, double confidence) {

    public String providerId() {
        return pattern.providerId();
    }
}
