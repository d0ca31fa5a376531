package com.di.taskpilot.metrics;

/** Raised by a store when a read or write cannot be completed. Callers recover locally. */
public class MetricsStoreException extends RuntimeException {

    public MetricsStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
