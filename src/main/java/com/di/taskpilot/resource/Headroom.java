package com.di.taskpilot.resource;

/** Remaining percentage points below each safety ceiling, never negative. */
public record Headroom(double cpu, double mem) {
}
