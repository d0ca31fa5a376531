package com.di.taskpilot.resource;

/** Invoked once per state transition, after the new state is visible through {@link ResourceMonitor#state()}. */
@FunctionalInterface
public interface MonitorStateListener {
    void onStateChange(MonitorState previous, MonitorState current, ResourceSample sample);
}
