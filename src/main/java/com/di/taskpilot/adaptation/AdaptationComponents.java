package com.di.taskpilot.adaptation;

import com.di.taskpilot.learner.ContextLearner;
import com.di.taskpilot.router.AdaptiveRouter;
import com.di.taskpilot.tracker.PerformanceTracker;

/**
 * The tracker, learner and router trio, created together on first use of monitoring.
 */
public record AdaptationComponents(PerformanceTracker tracker, ContextLearner learner, AdaptiveRouter router) {
}
