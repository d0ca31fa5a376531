package com.di.taskpilot.scheduler;

import com.di.taskpilot.exception.FailureCategory;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * A unit of work owned by the {@link PriorityScheduler} from acceptance until it reaches the history ring.
 * Lifecycle fields are written only by the scheduler.
 */
@Getter
public class ScheduledTask {

    public static final double DEFAULT_ESTIMATED_CPU = 10.0;
    public static final double DEFAULT_ESTIMATED_MEM = 5.0;
    public static final Duration DEFAULT_MAX_RUNTIME = Duration.ofSeconds(30);

    private final String id;
    private final TaskPriority priority;
    @Getter(AccessLevel.NONE)
    private final TaskCallback callback;
    /** Percentage points of host CPU. */
    private final double estimatedCpu;
    /** Percentage points of host memory. */
    private final double estimatedMem;
    private final Duration maxRuntime;
    private final String description;

    private volatile Instant createdAt;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile TaskState state = TaskState.PENDING;
    private volatile String error;
    private volatile FailureCategory failureCategory;

    @Builder
    private ScheduledTask(String id, TaskPriority priority, TaskCallback callback,
                          Double estimatedCpu, Double estimatedMem, Duration maxRuntime, String description) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("task id is required");
        if (callback == null) throw new IllegalArgumentException("callback is required for task " + id);
        this.id = id;
        this.priority = priority != null ? priority : TaskPriority.NORMAL;
        this.callback = callback;
        this.estimatedCpu = estimatedCpu != null ? estimatedCpu : DEFAULT_ESTIMATED_CPU;
        this.estimatedMem = estimatedMem != null ? estimatedMem : DEFAULT_ESTIMATED_MEM;
        this.maxRuntime = maxRuntime != null ? maxRuntime : DEFAULT_MAX_RUNTIME;
        this.description = description;
    }

    /** True once cancelled or flagged for timeout; bodies use this for cooperative cancellation. */
    public boolean isCancelled() {
        return state == TaskState.THROTTLED;
    }

    public Duration runtime() {
        Instant start = startedAt;
        if (start == null) return Duration.ZERO;
        Instant end = finishedAt;
        return end != null ? Duration.between(start, end) : Duration.ZERO;
    }

    void invoke() throws Exception {
        callback.run(this);
    }

    // --- Transitions, scheduler only ---

    synchronized void markAccepted(Instant now) {
        this.createdAt = now;
        this.state = TaskState.PENDING;
    }

    synchronized void markRunning(Instant now) {
        this.startedAt = now;
        this.state = TaskState.RUNNING;
    }

    /** @return true when the task was pending or running and is now marked. */
    synchronized boolean markThrottled() {
        if (state == TaskState.PENDING || state == TaskState.RUNNING || state == TaskState.PAUSED) {
            state = TaskState.THROTTLED;
            return true;
        }
        return false;
    }

    /** A body that ran past cancellation keeps the THROTTLED mark. */
    synchronized void markCompleted(Instant now) {
        this.finishedAt = now;
        if (state == TaskState.RUNNING) {
            state = TaskState.COMPLETED;
        }
    }

    synchronized void markFailed(Instant now, Throwable cause) {
        this.finishedAt = now;
        this.state = TaskState.FAILED;
        this.failureCategory = FailureCategory.categorize(cause);
        this.error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    synchronized void markAbandoned(Instant now, String reason) {
        this.finishedAt = now;
        this.state = TaskState.FAILED;
        this.failureCategory = FailureCategory.UNKNOWN;
        this.error = reason;
    }

    @Override
    public String toString() {
        return "ScheduledTask{" + id + ", " + priority + ", " + state + "}";
    }
}
