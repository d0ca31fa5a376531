package com.di.taskpilot.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Categories for task-body failures and unhandled API errors.
 * <p>Usage: {@code FailureCategory category = FailureCategory.categorize(exception);}
 * <p>To add a category: add the constant (before CALLBACK_ERROR) and a matcher in {@link #MATCHERS}.
 */
public enum FailureCategory {

    TIMEOUT("Timeout", "Work exceeded its time limit"),
    INTERRUPTED("Interrupted", "Worker thread was interrupted"),
    INVALID_INPUT("Invalid input", "Argument or state validation failed"),
    STORAGE_ERROR("Storage error", "Metrics or knowledge store read/write failed"),
    RESOURCE_EXHAUSTION("Resource exhaustion", "Host memory or file system exhausted"),
    PERMISSION_DENIED("Permission denied", "Operation rejected by the authorization policy"),
    CALLBACK_ERROR("Callback error", "Task body raised an unclassified error"),
    UNKNOWN("Unknown error", "No exception information");

    private final String name;
    private final String description;

    FailureCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** First match wins. */
    private static final Map<Predicate<Throwable>, FailureCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(FailureCategory::isTimeout, TIMEOUT);
        MATCHERS.put(FailureCategory::isInterrupted, INTERRUPTED);
        MATCHERS.put(FailureCategory::isPermission, PERMISSION_DENIED);
        MATCHERS.put(FailureCategory::isStorage, STORAGE_ERROR);
        MATCHERS.put(FailureCategory::isResourceExhaustion, RESOURCE_EXHAUSTION);
        MATCHERS.put(FailureCategory::isInvalidInput, INVALID_INPUT);
    }

    public static FailureCategory categorize(Throwable t) {
        if (t == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, FailureCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(t)) {
                return e.getValue();
            }
        }
        return CALLBACK_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isTimeout(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException;
    }

    private static boolean isInterrupted(Throwable t) {
        return t instanceof InterruptedException
                || t instanceof java.nio.channels.ClosedByInterruptException;
    }

    private static boolean isPermission(Throwable t) {
        return t instanceof SecurityException
                || t instanceof java.nio.file.AccessDeniedException;
    }

    private static boolean isStorage(Throwable t) {
        return t instanceof java.sql.SQLException
                || t instanceof org.springframework.dao.DataAccessException
                || t instanceof java.io.UncheckedIOException;
    }

    private static boolean isResourceExhaustion(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof StackOverflowError
                || t instanceof java.nio.file.FileSystemException
                || (t instanceof java.io.IOException && messageContains(t, "no space"));
    }

    private static boolean isInvalidInput(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException;
    }

    private static boolean messageContains(Throwable t, String keyword) {
        String msg = t.getMessage();
        return msg != null && msg.toLowerCase().contains(keyword);
    }

    @Override
    public String toString() {
        return name();
    }
}
