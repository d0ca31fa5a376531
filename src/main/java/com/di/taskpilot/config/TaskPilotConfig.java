package com.di.taskpilot.config;

import com.di.taskpilot.adaptation.AdaptationComponents;
import com.di.taskpilot.learner.ContextLearner;
import com.di.taskpilot.resource.ResourceProbe;
import com.di.taskpilot.resource.SystemResourceProbe;
import com.di.taskpilot.router.AdaptiveRouter;
import com.di.taskpilot.tracker.PerformanceTracker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.time.Clock;

@Configuration
public class TaskPilotConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResourceProbe resourceProbe(Clock clock) {
        return new SystemResourceProbe(clock);
    }

    /** Resolved by the orchestrator on first use of monitoring. */
    @Bean
    @Lazy
    public AdaptationComponents adaptationComponents(PerformanceTracker tracker, ContextLearner learner,
                                                     AdaptiveRouter router) {
        return new AdaptationComponents(tracker, learner, router);
    }
}
