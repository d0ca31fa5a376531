package com.di.taskpilot.resource;

/**
 * Source of raw host readings. The monitor is the only caller.
 */
public interface ResourceProbe {

    /**
     * Takes a fresh reading. Implementations may block for the duration of the underlying OS call.
     */
    ResourceSample read();
}
