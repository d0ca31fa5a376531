package com.di.taskpilot.scheduler;

import com.di.taskpilot.resource.MonitorState;
import com.di.taskpilot.resource.MonitorStateListener;
import com.di.taskpilot.resource.ResourceMonitor;
import com.di.taskpilot.resource.ResourceSample;
import com.di.taskpilot.util.DaemonThreadFactory;
import com.di.taskpilot.util.MdcPropagation;
import com.di.taskpilot.util.MetricsCollector;
import com.di.taskpilot.util.RingBuffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Admits, queues, runs and times out tasks under a concurrency ceiling driven by the resource monitor.
 * <p>
 * One coordinator thread runs {@link #tick()} at a fixed period; each admitted task runs on its own worker
 * thread. Within a priority tasks are FIFO; across priorities the highest drains first, subject to the
 * current {@link ThrottleLevel}. The ceiling is recomputed every tick. Timeouts are detection-only.
 */
@Slf4j
@Component
public class PriorityScheduler {

    private final ResourceMonitor monitor;
    private final SchedulerProperties properties;
    private final MetricsCollector metrics;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<TaskPriority, ArrayDeque<ScheduledTask>> queues = new EnumMap<>(TaskPriority.class);
    private final Map<String, ScheduledTask> active = new LinkedHashMap<>();
    private final RingBuffer<ScheduledTask> history;

    private final AtomicLong tasksScheduled = new AtomicLong();
    private final AtomicLong tasksRejected = new AtomicLong();
    private final AtomicLong tasksCompleted = new AtomicLong();
    private final AtomicLong tasksFailed = new AtomicLong();
    private final AtomicLong tasksThrottled = new AtomicLong();
    private final DoubleAdder totalRuntimeSeconds = new DoubleAdder();

    private final List<ThrottleListener> throttleListeners = new CopyOnWriteArrayList<>();
    private volatile ThrottleLevel throttleLevel = ThrottleLevel.NONE;

    private final MonitorStateListener criticalEdge = this::onMonitorStateChange;
    private ScheduledExecutorService coordinator;
    private ExecutorService workers;
    private volatile boolean running;

    public PriorityScheduler(ResourceMonitor monitor, SchedulerProperties properties,
                             MetricsCollector metrics, Clock clock) {
        this.monitor = monitor;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.history = new RingBuffer<>(Math.max(1, properties.getHistorySize()));
        for (TaskPriority p : TaskPriority.values()) {
            queues.put(p, new ArrayDeque<>());
        }
    }

    // ------------------------------------------------------------------ //
    // Lifecycle                                                           //
    // ------------------------------------------------------------------ //

    public synchronized void start() {
        if (running) return;
        workers = Executors.newCachedThreadPool(new DaemonThreadFactory("taskpilot-task"));
        coordinator = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("taskpilot-scheduler"));
        long period = Math.max(1L, properties.getTick().toMillis());
        coordinator.scheduleWithFixedDelay(this::safeTick, period, period, TimeUnit.MILLISECONDS);
        monitor.addStateListener(criticalEdge);
        running = true;
        log.info("[SCHEDULER] Started (tick={}ms, maxConcurrent={})", period, properties.getMaxConcurrent());
    }

    /**
     * Stops admitting work. Task bodies already running are left to finish on their own.
     */
    public synchronized void stop() {
        if (!running) return;
        running = false;
        monitor.removeStateListener(criticalEdge);
        coordinator.shutdownNow();
        workers.shutdown();
        coordinator = null;
        log.info("[SCHEDULER] Stopped ({} task(s) still running)", activeCount());
    }

    public boolean isRunning() {
        return running;
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("[SCHEDULER] Tick failed: {}", e.getMessage(), e);
        }
    }

    private void onMonitorStateChange(MonitorState previous, MonitorState current, ResourceSample sample) {
        if (current == MonitorState.CRITICAL) {
            updateThrottle(ThrottleLevel.CRITICAL);
        }
    }

    // ------------------------------------------------------------------ //
    // Admission                                                           //
    // ------------------------------------------------------------------ //

    /**
     * Queues the task unless the host is critical (only CRITICAL priority passes) or, for priorities below HIGH,
     * the monitor reports insufficient headroom for the task's estimates.
     *
     * @return false when declined; the task is left untouched in that case
     */
    public boolean schedule(ScheduledTask task) {
        if (task == null) throw new IllegalArgumentException("task is required");
        MonitorState state = monitor.state();
        if (state == MonitorState.CRITICAL && task.getPriority() != TaskPriority.CRITICAL) {
            reject(task, "critical_state");
            return false;
        }
        if (task.getPriority().value() > TaskPriority.HIGH.value()
                && !monitor.canStartWork(task.getEstimatedCpu(), task.getEstimatedMem())) {
            reject(task, "insufficient_headroom");
            return false;
        }
        synchronized (lock) {
            if (active.containsKey(task.getId()) || isQueued(task.getId())) {
                reject(task, "duplicate_id");
                return false;
            }
            task.markAccepted(clock.instant());
            queues.get(task.getPriority()).addLast(task);
        }
        tasksScheduled.incrementAndGet();
        metrics.recordTaskScheduled(task.getPriority().name());
        log.debug("[SCHEDULER] Queued {} ({})", task.getId(), task.getPriority());
        return true;
    }

    private void reject(ScheduledTask task, String reason) {
        tasksRejected.incrementAndGet();
        metrics.recordTaskRejected(reason);
        log.info("[SCHEDULER] Rejected {} ({}): {}", task.getId(), task.getPriority(), reason);
    }

    /** Caller holds {@link #lock}. */
    private boolean isQueued(String id) {
        for (ArrayDeque<ScheduledTask> q : queues.values()) {
            for (ScheduledTask t : q) {
                if (t.getId().equals(id)) return true;
            }
        }
        return false;
    }

    /**
     * Removes a pending task, or flags a running one THROTTLED. Running bodies are not interrupted.
     */
    public boolean cancel(String id) {
        ScheduledTask runningTask;
        synchronized (lock) {
            for (ArrayDeque<ScheduledTask> q : queues.values()) {
                var it = q.iterator();
                while (it.hasNext()) {
                    ScheduledTask t = it.next();
                    if (t.getId().equals(id)) {
                        it.remove();
                        t.markThrottled();
                        history.add(t);
                        log.info("[SCHEDULER] Cancelled pending task {}", id);
                        return true;
                    }
                }
            }
            runningTask = active.get(id);
        }
        if (runningTask != null && runningTask.markThrottled()) {
            tasksThrottled.incrementAndGet();
            metrics.recordTaskThrottled();
            log.info("[SCHEDULER] Cancellation flagged on running task {}", id);
            return true;
        }
        return false;
    }

    // ------------------------------------------------------------------ //
    // Coordinator                                                         //
    // ------------------------------------------------------------------ //

    /**
     * One admission pass: recompute the throttle, admit up to the ceiling, flag overrunning tasks.
     */
    public void tick() {
        ThrottleLevel level = computeThrottle();
        updateThrottle(level);

        List<ScheduledTask> launched = new ArrayList<>();
        Instant now = clock.instant();
        synchronized (lock) {
            int ceiling = level.ceiling(properties.getMaxConcurrent());
            while (active.size() < ceiling) {
                ScheduledTask next = pollNext(level);
                if (next == null) break;
                next.markRunning(now);
                active.put(next.getId(), next);
                launched.add(next);
            }
        }
        for (ScheduledTask task : launched) {
            launch(task);
        }
        flagOverruns(now);
    }

    ThrottleLevel computeThrottle() {
        ThrottleLevel fromSample = ThrottleLevel.fromSample(monitor.sample());
        return ThrottleLevel.max(ThrottleLevel.fromState(monitor.state()), fromSample);
    }

    private void updateThrottle(ThrottleLevel level) {
        ThrottleLevel previous;
        synchronized (lock) {
            previous = throttleLevel;
            if (previous == level) return;
            throttleLevel = level;
        }
        log.info("[SCHEDULER] Throttle {} -> {} (ceiling {})", previous, level, level.ceiling(properties.getMaxConcurrent()));
        for (ThrottleListener l : throttleListeners) {
            try {
                l.onThrottleChange(previous, level);
            } catch (RuntimeException e) {
                log.warn("[SCHEDULER] Throttle listener failed: {}", e.getMessage(), e);
            }
        }
    }

    /** Caller holds {@link #lock}. */
    private ScheduledTask pollNext(ThrottleLevel level) {
        for (TaskPriority p : TaskPriority.values()) {
            if (!level.admits(p)) continue;
            ScheduledTask t = queues.get(p).pollFirst();
            if (t != null) return t;
        }
        return null;
    }

    private void launch(ScheduledTask task) {
        ExecutorService pool = workers;
        try {
            if (pool == null) throw new RejectedExecutionException("scheduler not started");
            pool.execute(MdcPropagation.wrapWithTaskId(task.getId(), () -> execute(task)));
            log.debug("[SCHEDULER] Launched {}", task.getId());
        } catch (RejectedExecutionException e) {
            log.warn("[SCHEDULER] Could not launch {}: {}", task.getId(), e.getMessage());
            task.markAbandoned(clock.instant(), "launch rejected: " + e.getMessage());
            tasksFailed.incrementAndGet();
            release(task);
        }
    }

    /**
     * Runs the body on the calling thread and records its outcome. An interrupted body leaves the thread's
     * interrupt flag set.
     */
    void execute(ScheduledTask task) {
        try {
            task.invoke();
            task.markCompleted(clock.instant());
            tasksCompleted.incrementAndGet();
            metrics.recordTaskCompleted(task.runtime());
            log.debug("[SCHEDULER] Completed {} in {}ms", task.getId(), task.runtime().toMillis());
        } catch (InterruptedException e) {
            recordFailure(task, e);
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            recordFailure(task, e);
        } catch (Error e) {
            recordFailure(task, e);
            throw e;
        } finally {
            release(task);
        }
    }

    private void recordFailure(ScheduledTask task, Throwable cause) {
        task.markFailed(clock.instant(), cause);
        tasksFailed.incrementAndGet();
        metrics.recordTaskFailed(task.runtime(), task.getFailureCategory().name());
        log.warn("[SCHEDULER] Task {} failed [{}]: {}", task.getId(), task.getFailureCategory().getName(), task.getError());
    }

    private void release(ScheduledTask task) {
        synchronized (lock) {
            active.remove(task.getId());
            history.add(task);
        }
        totalRuntimeSeconds.add(task.runtime().toNanos() / 1e9);
    }

    private void flagOverruns(Instant now) {
        List<ScheduledTask> running;
        synchronized (lock) {
            running = new ArrayList<>(active.values());
        }
        for (ScheduledTask t : running) {
            Instant started = t.getStartedAt();
            if (started == null || t.getState() != TaskState.RUNNING) continue;
            Duration elapsed = Duration.between(started, now);
            if (elapsed.compareTo(t.getMaxRuntime()) > 0 && t.markThrottled()) {
                tasksThrottled.incrementAndGet();
                metrics.recordTaskThrottled();
                log.warn("[SCHEDULER] Task {} exceeded max runtime {} (elapsed {}ms); flagged THROTTLED",
                        t.getId(), t.getMaxRuntime(), elapsed.toMillis());
            }
        }
    }

    // ------------------------------------------------------------------ //
    // Queries                                                             //
    // ------------------------------------------------------------------ //

    public ThrottleLevel throttleLevel() {
        return throttleLevel;
    }

    public int activeCount() {
        synchronized (lock) {
            return active.size();
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return queues.values().stream().mapToInt(ArrayDeque::size).sum();
        }
    }

    /** Looks the task up among queued, running and recently finished tasks. */
    public Optional<ScheduledTask> find(String id) {
        synchronized (lock) {
            ScheduledTask t = active.get(id);
            if (t != null) return Optional.of(t);
            for (ArrayDeque<ScheduledTask> q : queues.values()) {
                for (ScheduledTask queued : q) {
                    if (queued.getId().equals(id)) return Optional.of(queued);
                }
            }
            List<ScheduledTask> finished = history.toList();
            for (int i = finished.size() - 1; i >= 0; i--) {
                if (finished.get(i).getId().equals(id)) return Optional.of(finished.get(i));
            }
        }
        return Optional.empty();
    }

    /** Finished or cancelled tasks, oldest first. */
    public List<ScheduledTask> history() {
        synchronized (lock) {
            return history.toList();
        }
    }

    public SchedulerStatus status() {
        Map<TaskPriority, Integer> pending = new EnumMap<>(TaskPriority.class);
        List<String> activeIds;
        synchronized (lock) {
            queues.forEach((p, q) -> pending.put(p, q.size()));
            activeIds = new ArrayList<>(active.keySet());
        }
        ThrottleLevel level = throttleLevel;
        return SchedulerStatus.builder()
                .running(running)
                .throttleLevel(level)
                .maxConcurrent(properties.getMaxConcurrent())
                .effectiveConcurrency(level.ceiling(properties.getMaxConcurrent()))
                .activeTaskIds(activeIds)
                .pendingByPriority(pending)
                .tasksScheduled(tasksScheduled.get())
                .tasksRejected(tasksRejected.get())
                .tasksCompleted(tasksCompleted.get())
                .tasksFailed(tasksFailed.get())
                .tasksThrottled(tasksThrottled.get())
                .totalRuntimeSeconds(totalRuntimeSeconds.sum())
                .build();
    }

    public void addThrottleListener(ThrottleListener listener) {
        throttleListeners.add(listener);
    }
}
