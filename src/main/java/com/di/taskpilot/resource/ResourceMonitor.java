package com.di.taskpilot.resource;

import com.di.taskpilot.guardrail.SafetyLimits;
import com.di.taskpilot.util.DaemonThreadFactory;
import com.di.taskpilot.util.RingBuffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Single source of truth for host load.
 * <p>
 * Every fresh sample re-derives the {@link MonitorState}; the background poll loop runs at the interval bound
 * to the current state and is re-armed on every transition. Reads within the cache TTL are served from the
 * last sample. State listeners fire exactly once per transition.
 */
@Slf4j
@Component
public class ResourceMonitor {

    private static final double ACTIVE_CPU_PERCENT = 30.0;
    private static final double ACTIVE_MEM_PERCENT = 40.0;
    private static final int RECENT_WINDOW = 10;
    /** Percentage points the recent mean must move before the trend is reported as rising or falling. */
    private static final double TREND_BAND = 5.0;

    private final ResourceProbe probe;
    private final ResourceMonitorProperties properties;
    private final Clock clock;

    private final Object lock = new Object();
    private final RingBuffer<ResourceSample> history;
    private ResourceSample cached;
    private MonitorState state = MonitorState.IDLE;
    private Instant lastBusyAt;
    private long transitions;

    private final Set<String> activeWork = ConcurrentHashMap.newKeySet();
    private final List<MonitorStateListener> stateListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<ResourceSample>> sampleListeners = new CopyOnWriteArrayList<>();

    private final Object pollLock = new Object();
    private ScheduledExecutorService poller;
    private ScheduledFuture<?> nextPoll;
    private volatile boolean running;

    public ResourceMonitor(ResourceProbe probe, ResourceMonitorProperties properties, Clock clock) {
        this.probe = probe;
        this.properties = properties;
        this.clock = clock;
        this.history = new RingBuffer<>(Math.max(1, properties.getHistorySize()));
        this.lastBusyAt = clock.instant();
        validateIntervals(properties.getPollInterval());
    }

    private static void validateIntervals(ResourceMonitorProperties.PollInterval intervals) {
        MonitorState[] states = MonitorState.values();
        for (int i = 1; i < states.length; i++) {
            Duration calmer = intervals.forState(states[i - 1]);
            Duration severer = intervals.forState(states[i]);
            if (severer.compareTo(calmer) >= 0) {
                throw new IllegalArgumentException("Poll interval for " + states[i] + " (" + severer
                        + ") must be shorter than for " + states[i - 1] + " (" + calmer + ")");
            }
        }
    }

    // ------------------------------------------------------------------ //
    // Lifecycle                                                           //
    // ------------------------------------------------------------------ //

    public void start() {
        synchronized (pollLock) {
            if (running) return;
            running = true;
            poller = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("taskpilot-monitor"));
            nextPoll = poller.schedule(this::poll, 0, TimeUnit.MILLISECONDS);
        }
        log.info("[MONITOR] Started (state={}, interval={})", state(), pollInterval());
    }

    public void stop() {
        synchronized (pollLock) {
            if (!running) return;
            running = false;
            if (nextPoll != null) nextPoll.cancel(false);
            poller.shutdownNow();
            poller = null;
            nextPoll = null;
        }
        log.info("[MONITOR] Stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void poll() {
        try {
            sample(true);
        } catch (RuntimeException e) {
            log.warn("[MONITOR] Poll failed: {}", e.getMessage(), e);
        } finally {
            rearm();
        }
    }

    private void rearm() {
        synchronized (pollLock) {
            if (!running || poller == null) return;
            if (nextPoll != null) nextPoll.cancel(false);
            nextPoll = poller.schedule(this::poll, pollInterval().toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    // ------------------------------------------------------------------ //
    // Sampling                                                            //
    // ------------------------------------------------------------------ //

    public ResourceSample sample() {
        return sample(false);
    }

    /**
     * Returns the cached sample when younger than the cache TTL, else reads the probe and re-derives the state.
     * A failing probe yields the last good sample (or an all-zero sample before the first success).
     */
    public ResourceSample sample(boolean forceRefresh) {
        Instant now = clock.instant();
        synchronized (lock) {
            if (!forceRefresh && cached != null
                    && Duration.between(cached.timestamp(), now).compareTo(properties.getCacheTtl()) < 0) {
                return cached;
            }
        }
        ResourceSample fresh;
        try {
            fresh = probe.read();
        } catch (RuntimeException e) {
            log.warn("[MONITOR] Probe read failed, serving last sample: {}", e.getMessage());
            synchronized (lock) {
                return cached != null ? cached : new ResourceSample(now, 0.0, 0.0, 0L, 0L);
            }
        }
        return ingest(fresh);
    }

    private ResourceSample ingest(ResourceSample fresh) {
        MonitorState previous;
        MonitorState current;
        synchronized (lock) {
            cached = fresh;
            history.add(fresh);
            previous = state;
            current = derive(fresh, fresh.timestamp());
            if (current != previous) {
                state = current;
                transitions++;
            }
        }
        for (Consumer<ResourceSample> l : sampleListeners) {
            try {
                l.accept(fresh);
            } catch (RuntimeException e) {
                log.warn("[MONITOR] Sample listener failed: {}", e.getMessage(), e);
            }
        }
        if (current != previous) {
            onTransition(previous, current, fresh);
        }
        return fresh;
    }

    /** Caller holds {@link #lock}. */
    private MonitorState derive(ResourceSample s, Instant now) {
        double cpuCeiling = SafetyLimits.CPU_CEILING_PERCENT;
        double memCeiling = SafetyLimits.MEM_CEILING_PERCENT;
        boolean busy = s.cpuPercent() > ACTIVE_CPU_PERCENT || s.memPercent() > ACTIVE_MEM_PERCENT || !activeWork.isEmpty();
        if (busy) {
            lastBusyAt = now;
        }
        if (s.cpuPercent() > cpuCeiling || s.memPercent() > memCeiling) {
            return MonitorState.CRITICAL;
        }
        if (s.cpuPercent() > cpuCeiling * SafetyLimits.ALERT_FRACTION || s.memPercent() > memCeiling * SafetyLimits.ALERT_FRACTION) {
            return MonitorState.ALERT;
        }
        if (busy) {
            return MonitorState.ACTIVE;
        }
        if (Duration.between(lastBusyAt, now).compareTo(properties.getIdleTimeout()) >= 0) {
            return MonitorState.IDLE;
        }
        return state == MonitorState.IDLE ? MonitorState.IDLE : MonitorState.ACTIVE;
    }

    private void onTransition(MonitorState previous, MonitorState current, ResourceSample sample) {
        if (current.isMoreSevereThan(previous) && current.isMoreSevereThan(MonitorState.ACTIVE)) {
            log.warn("[MONITOR] {} -> {} (cpu={}%, mem={}%)", previous, current,
                    Math.round(sample.cpuPercent()), Math.round(sample.memPercent()));
        } else {
            log.info("[MONITOR] {} -> {} (cpu={}%, mem={}%)", previous, current,
                    Math.round(sample.cpuPercent()), Math.round(sample.memPercent()));
        }
        for (MonitorStateListener l : stateListeners) {
            try {
                l.onStateChange(previous, current, sample);
            } catch (RuntimeException e) {
                log.warn("[MONITOR] State listener failed: {}", e.getMessage(), e);
            }
        }
        rearm();
    }

    // ------------------------------------------------------------------ //
    // Queries                                                             //
    // ------------------------------------------------------------------ //

    public MonitorState state() {
        synchronized (lock) {
            return state;
        }
    }

    public Duration pollInterval() {
        return properties.getPollInterval().forState(state());
    }

    public Headroom headroom() {
        ResourceSample s = sample();
        return new Headroom(
                Math.max(0.0, SafetyLimits.CPU_CEILING_PERCENT - s.cpuPercent()),
                Math.max(0.0, SafetyLimits.MEM_CEILING_PERCENT - s.memPercent()));
    }

    /**
     * True iff both estimates (percentage points) fit inside the current headroom.
     */
    public boolean canStartWork(double estimatedCpu, double estimatedMem) {
        Headroom h = headroom();
        return h.cpu() >= estimatedCpu && h.mem() >= estimatedMem;
    }

    /** Both metrics strictly under their ceilings. */
    public boolean isSafe() {
        ResourceSample s = sample();
        return s.cpuPercent() < SafetyLimits.CPU_CEILING_PERCENT && s.memPercent() < SafetyLimits.MEM_CEILING_PERCENT;
    }

    /** How long a caller should wait before starting new work in the current state. */
    public Duration suggestStartDelay() {
        return switch (state()) {
            case CRITICAL -> Duration.ofSeconds(5);
            case ALERT -> Duration.ofSeconds(2);
            case ACTIVE -> Duration.ofMillis(500);
            case IDLE -> Duration.ZERO;
        };
    }

    /** Samples, oldest first. */
    public List<ResourceSample> history() {
        synchronized (lock) {
            return history.toList();
        }
    }

    public ResourceTrend trend() {
        List<ResourceSample> samples = history();
        if (samples.size() < 4) {
            return ResourceTrend.insufficient(samples.size());
        }
        int half = samples.size() / 2;
        List<ResourceSample> older = samples.subList(0, half);
        List<ResourceSample> recent = samples.subList(half, samples.size());
        return new ResourceTrend(
                direction(meanCpu(older), meanCpu(recent)),
                direction(meanMem(older), meanMem(recent)),
                samples.size());
    }

    private static ResourceTrend.Direction direction(double older, double recent) {
        double delta = recent - older;
        if (delta > TREND_BAND) return ResourceTrend.Direction.RISING;
        if (delta < -TREND_BAND) return ResourceTrend.Direction.FALLING;
        return ResourceTrend.Direction.STABLE;
    }

    public MonitorStats stats() {
        ResourceSample s = sample();
        List<ResourceSample> recent;
        long transitionCount;
        int historySize;
        MonitorState current;
        synchronized (lock) {
            recent = history.lastN(RECENT_WINDOW);
            historySize = history.size();
            transitionCount = transitions;
            current = state;
        }
        return MonitorStats.builder()
                .state(current)
                .pollInterval(properties.getPollInterval().forState(current))
                .running(running)
                .cpuPercent(s.cpuPercent())
                .memPercent(s.memPercent())
                .recentAvgCpu(meanCpu(recent))
                .recentAvgMem(meanMem(recent))
                .cpuHeadroom(Math.max(0.0, SafetyLimits.CPU_CEILING_PERCENT - s.cpuPercent()))
                .memHeadroom(Math.max(0.0, SafetyLimits.MEM_CEILING_PERCENT - s.memPercent()))
                .historySize(historySize)
                .activeWork(activeWork.size())
                .stateTransitions(transitionCount)
                .build();
    }

    private static double meanCpu(List<ResourceSample> samples) {
        return samples.stream().mapToDouble(ResourceSample::cpuPercent).average().orElse(0.0);
    }

    private static double meanMem(List<ResourceSample> samples) {
        return samples.stream().mapToDouble(ResourceSample::memPercent).average().orElse(0.0);
    }

    // ------------------------------------------------------------------ //
    // Activity and listeners                                              //
    // ------------------------------------------------------------------ //

    /** Marks the host busy now, postponing the IDLE transition; wakes an idle monitor. */
    public void signalActivity() {
        MonitorState previous;
        ResourceSample last;
        synchronized (lock) {
            lastBusyAt = clock.instant();
            previous = state;
            last = cached;
            if (state != MonitorState.IDLE) return;
            state = MonitorState.ACTIVE;
            transitions++;
        }
        onTransition(previous, MonitorState.ACTIVE,
                last != null ? last : new ResourceSample(clock.instant(), 0.0, 0.0, 0L, 0L));
    }

    /** Registered work keeps the monitor out of IDLE until unregistered. */
    public void registerWork(String workId) {
        if (workId == null) return;
        activeWork.add(workId);
        signalActivity();
    }

    public void unregisterWork(String workId) {
        if (workId == null) return;
        activeWork.remove(workId);
    }

    public int activeWorkCount() {
        return activeWork.size();
    }

    public void addStateListener(MonitorStateListener listener) {
        stateListeners.add(listener);
    }

    public void removeStateListener(MonitorStateListener listener) {
        stateListeners.remove(listener);
    }

    public void addSampleListener(Consumer<ResourceSample> listener) {
        sampleListeners.add(listener);
    }
}
