package com.di.taskpilot.resource;

import java.time.Instant;

/**
 * Immutable point-in-time reading of host load.
 *
 * @param cpuPercent   system CPU utilisation, 0-100
 * @param memPercent   physical memory utilisation, 0-100
 * @param memUsed      bytes in use
 * @param memAvailable bytes available
 */
public record ResourceSample(Instant timestamp, double cpuPercent, double memPercent, long memUsed, long memAvailable) {

    public long memTotal() {
        return memUsed + memAvailable;
    }
}
