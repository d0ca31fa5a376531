package com.di.taskpilot.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Carries SLF4J MDC into task execution threads so that every log line emitted by a task body
 * is tagged with its {@code taskId}.
 * <p>
 * MDC is thread-local; without this, logs from the scheduler's worker pool lose the correlation.
 * <ul>
 *   <li>Wrap before submitting: {@code executor.execute(MdcPropagation.wrapRunnable(() -> work()));}</li>
 *   <li>Run with an explicit task id: {@code MdcPropagation.runWithTaskId(id, () -> work());}</li>
 * </ul>
 */
public final class MdcPropagation {

    public static final String TASK_ID = "taskId";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration of the task
     * and clears it in {@code finally}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> runWithMdcContext(contextMap, task);
    }

    /**
     * Same as {@link #wrapRunnable(Runnable)} but additionally binds {@code taskId} for the child thread.
     */
    public static Runnable wrapWithTaskId(String taskId, Runnable task) {
        Map<String, String> contextMap = new HashMap<>(copyMdc());
        if (taskId != null) contextMap.put(TASK_ID, taskId);
        return () -> runWithMdcContext(contextMap, task);
    }

    /** Runs the task on the current thread with {@code taskId} bound. */
    public static void runWithTaskId(String taskId, Runnable task) {
        runWithMdcContext(taskId != null ? Map.of(TASK_ID, taskId) : Map.of(), task);
    }

    /**
     * Runs the given task in the current thread with the provided context set in MDC for the duration.
     */
    public static void runWithMdcContext(Map<String, String> contextMap, Runnable task) {
        setMdc(contextMap);
        try {
            task.run();
        } finally {
            clearMdc(contextMap);
        }
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
