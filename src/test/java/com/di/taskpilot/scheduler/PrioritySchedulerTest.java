package com.di.taskpilot.scheduler;

import com.di.taskpilot.exception.FailureCategory;
import com.di.taskpilot.resource.ResourceMonitor;
import com.di.taskpilot.resource.ResourceMonitorProperties;
import com.di.taskpilot.testsupport.MutableClock;
import com.di.taskpilot.testsupport.ScriptedResourceProbe;
import com.di.taskpilot.util.MetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PriorityScheduler Tests")
class PrioritySchedulerTest {

    private MutableClock clock;
    private ScriptedResourceProbe probe;
    private ResourceMonitor monitor;
    private SchedulerProperties properties;
    private SimpleMeterRegistry registry;
    private PriorityScheduler scheduler;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        probe = new ScriptedResourceProbe(clock, 5.0, 10.0);
        monitor = new ResourceMonitor(probe, new ResourceMonitorProperties(), clock);
        properties = new SchedulerProperties();
        // ticks are driven by the tests
        properties.setTick(Duration.ofHours(1));
        registry = new SimpleMeterRegistry();
        scheduler = new PriorityScheduler(monitor, properties, new MetricsCollector(registry), clock);
        scheduler.start();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        scheduler.stop();
    }

    private ScheduledTask blocking(String id, TaskPriority priority) {
        return ScheduledTask.builder()
                .id(id)
                .priority(priority)
                .callback(t -> release.await(5, TimeUnit.SECONDS))
                .build();
    }

    private void setLoad(double cpu, double mem) {
        probe.set(cpu, mem);
        clock.advance(Duration.ofSeconds(2));
    }

    private void awaitIdle() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (scheduler.activeCount() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, scheduler.activeCount());
    }

    // ============================================================================
    // Concurrency ceiling
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "5.0,  NONE,     3",
            "55.0, LIGHT,    2",
            "72.0, HEAVY,    1",
            "90.0, CRITICAL, 0"
    })
    @DisplayName("Should never run more tasks than the throttle ceiling allows")
    void testTick_ConcurrencyCeiling(double cpu, ThrottleLevel expectedLevel, int expectedRunning) {
        for (int i = 0; i < 5; i++) {
            assertTrue(scheduler.schedule(blocking("t-" + i, TaskPriority.HIGH)));
        }
        setLoad(cpu, 10.0);

        scheduler.tick();
        scheduler.tick();

        assertEquals(expectedLevel, scheduler.throttleLevel());
        assertEquals(expectedRunning, scheduler.activeCount());
        assertEquals(5 - expectedRunning, scheduler.pendingCount());
    }

    @Test
    @DisplayName("Should apply a throttle drop on the next tick")
    void testTick_ThrottleDropAppliesNextTick() {
        for (int i = 0; i < 4; i++) {
            scheduler.schedule(blocking("t-" + i, TaskPriority.HIGH));
        }
        setLoad(72.0, 10.0);
        scheduler.tick();
        assertEquals(1, scheduler.activeCount());

        setLoad(5.0, 10.0);
        scheduler.tick();
        assertEquals(ThrottleLevel.NONE, scheduler.throttleLevel());
        assertEquals(3, scheduler.activeCount());
    }

    @Test
    @DisplayName("Should raise the throttle to CRITICAL as soon as the monitor turns critical")
    void testCriticalEdge_RaisesThrottle() {
        List<ThrottleLevel> changes = Collections.synchronizedList(new ArrayList<>());
        scheduler.addThrottleListener((previous, current) -> changes.add(current));

        probe.set(95.0, 10.0);
        monitor.sample(true);

        assertEquals(ThrottleLevel.CRITICAL, scheduler.throttleLevel());
        assertEquals(List.of(ThrottleLevel.CRITICAL), changes);
    }

    // ============================================================================
    // Ordering
    // ============================================================================

    @Test
    @DisplayName("Should drain higher priorities first and keep FIFO within a tier")
    void testTick_PriorityThenFifo() throws InterruptedException {
        properties.setMaxConcurrent(1);
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        for (String[] row : new String[][]{{"low-1", "LOW"}, {"n-1", "NORMAL"}, {"high-1", "HIGH"}, {"n-2", "NORMAL"}}) {
            scheduler.schedule(ScheduledTask.builder()
                    .id(row[0])
                    .priority(TaskPriority.valueOf(row[1]))
                    .callback(t -> order.add(t.getId()))
                    .build());
        }

        for (int i = 0; i < 4; i++) {
            scheduler.tick();
            awaitIdle();
        }

        assertEquals(List.of("high-1", "n-1", "n-2", "low-1"), order);
        assertEquals(4, scheduler.history().size());
    }

    // ============================================================================
    // Admission
    // ============================================================================

    @Test
    @DisplayName("Should reject all but CRITICAL work while the host is critical")
    void testSchedule_CriticalState() {
        probe.set(95.0, 10.0);
        monitor.sample(true);

        assertFalse(scheduler.schedule(blocking("normal", TaskPriority.NORMAL)));
        assertTrue(scheduler.schedule(blocking("urgent", TaskPriority.CRITICAL)));
        assertEquals(1.0, registry.counter("taskpilot.scheduler.tasks.rejected", "reason", "critical_state").count());
    }

    @Test
    @DisplayName("Should reject NORMAL work that does not fit the headroom")
    void testSchedule_InsufficientHeadroom() {
        setLoad(75.0, 10.0);
        assertFalse(scheduler.schedule(blocking("big", TaskPriority.NORMAL)));
        assertTrue(scheduler.schedule(blocking("important", TaskPriority.HIGH)));
    }

    @Test
    @DisplayName("Should reject a duplicate task id")
    void testSchedule_DuplicateId() {
        assertTrue(scheduler.schedule(blocking("same", TaskPriority.NORMAL)));
        assertFalse(scheduler.schedule(blocking("same", TaskPriority.NORMAL)));
        assertEquals(1, scheduler.pendingCount());
    }

    // ============================================================================
    // Cancellation, failures and soft timeout
    // ============================================================================

    @Test
    @DisplayName("Should remove a cancelled pending task and mark it THROTTLED")
    void testCancel_Pending() {
        ScheduledTask task = blocking("c-1", TaskPriority.NORMAL);
        scheduler.schedule(task);

        assertTrue(scheduler.cancel("c-1"));
        assertEquals(0, scheduler.pendingCount());
        assertEquals(TaskState.THROTTLED, task.getState());
        assertTrue(task.isCancelled());
        assertEquals(List.of(task), scheduler.history());
        assertFalse(scheduler.cancel("missing"));
    }

    @Test
    @DisplayName("Should record a failing body as FAILED and free its slot")
    void testExecute_FailureReleasesSlot() throws InterruptedException {
        properties.setMaxConcurrent(1);
        ScheduledTask failing = ScheduledTask.builder()
                .id("bad")
                .callback(t -> {
                    throw new IllegalArgumentException("bad input");
                })
                .build();
        ScheduledTask next = ScheduledTask.builder().id("good").callback(t -> { }).build();
        scheduler.schedule(failing);
        scheduler.schedule(next);

        scheduler.tick();
        awaitIdle();
        scheduler.tick();
        awaitIdle();

        assertEquals(TaskState.FAILED, failing.getState());
        assertEquals(FailureCategory.INVALID_INPUT, failing.getFailureCategory());
        assertEquals("bad input", failing.getError());
        assertEquals(TaskState.COMPLETED, next.getState());
        assertEquals(1, scheduler.status().getTasksFailed());
        assertEquals(1, scheduler.status().getTasksCompleted());
    }

    @Test
    @DisplayName("Should classify an interrupted body and keep the interrupt flag on the worker")
    void testExecute_InterruptedBody() {
        ScheduledTask interrupted = ScheduledTask.builder()
                .id("sleeper")
                .callback(t -> {
                    throw new InterruptedException("woken up");
                })
                .build();
        interrupted.markRunning(clock.instant());

        try {
            scheduler.execute(interrupted);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }

        assertEquals(TaskState.FAILED, interrupted.getState());
        assertEquals(FailureCategory.INTERRUPTED, interrupted.getFailureCategory());
        assertEquals("woken up", interrupted.getError());
        assertEquals(1, scheduler.status().getTasksFailed());
    }

    @Test
    @DisplayName("Should flag an overrunning task THROTTLED without interrupting it")
    void testTick_SoftTimeout() throws InterruptedException {
        ScheduledTask slow = ScheduledTask.builder()
                .id("slow")
                .maxRuntime(Duration.ofSeconds(5))
                .callback(t -> release.await(5, TimeUnit.SECONDS))
                .build();
        scheduler.schedule(slow);
        scheduler.tick();
        assertEquals(TaskState.RUNNING, slow.getState());

        clock.advance(Duration.ofSeconds(10));
        scheduler.tick();

        assertEquals(TaskState.THROTTLED, slow.getState());
        assertTrue(slow.isCancelled());
        assertEquals(1, scheduler.activeCount());

        release.countDown();
        awaitIdle();
        assertEquals(TaskState.THROTTLED, slow.getState());
        assertEquals(1, scheduler.status().getTasksThrottled());
    }

    @Test
    @DisplayName("Should report pending counts per priority in the status")
    void testStatus() {
        scheduler.schedule(blocking("a", TaskPriority.HIGH));
        scheduler.schedule(blocking("b", TaskPriority.LOW));
        scheduler.schedule(blocking("c", TaskPriority.LOW));

        SchedulerStatus status = scheduler.status();
        assertTrue(status.isRunning());
        assertEquals(1, status.getPendingByPriority().get(TaskPriority.HIGH));
        assertEquals(2, status.getPendingByPriority().get(TaskPriority.LOW));
        assertEquals(3, status.getTasksScheduled());
        assertEquals(3, status.getEffectiveConcurrency());
    }
}
