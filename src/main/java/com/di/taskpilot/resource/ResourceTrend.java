package com.di.taskpilot.resource;

/** Direction of load comparing the recent half of the history against the older half. */
public record ResourceTrend(Direction cpu, Direction mem, int samples) {

    public enum Direction { RISING, FALLING, STABLE, INSUFFICIENT_DATA }

    public static ResourceTrend insufficient(int samples) {
        return new ResourceTrend(Direction.INSUFFICIENT_DATA, Direction.INSUFFICIENT_DATA, samples);
    }
}
