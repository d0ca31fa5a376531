package com.di.taskpilot.resource;

import com.di.taskpilot.testsupport.MutableClock;
import com.di.taskpilot.testsupport.ScriptedResourceProbe;
import com.di.taskpilot.util.MetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResourceMonitor Tests")
class ResourceMonitorTest {

    private MutableClock clock;
    private ScriptedResourceProbe probe;
    private ResourceMonitorProperties properties;
    private ResourceMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        probe = new ScriptedResourceProbe(clock, 5.0, 10.0);
        properties = new ResourceMonitorProperties();
        monitor = new ResourceMonitor(probe, properties, clock);
    }

    // ============================================================================
    // State derivation
    // ============================================================================

    @Test
    @DisplayName("Should report CRITICAL on the very next evaluation above a ceiling")
    void testState_CriticalImmediately() {
        monitor.sample(true);
        assertEquals(MonitorState.IDLE, monitor.state());

        probe.set(95.0, 20.0);
        monitor.sample(true);
        assertEquals(MonitorState.CRITICAL, monitor.state());

        probe.set(20.0, 75.0);
        clock.advance(Duration.ofSeconds(2));
        monitor.sample(true);
        assertEquals(MonitorState.CRITICAL, monitor.state());
    }

    @Test
    @DisplayName("Should report ALERT above 85% of a ceiling")
    void testState_Alert() {
        probe.set(70.0, 10.0);
        monitor.sample(true);
        assertEquals(MonitorState.ALERT, monitor.state());
    }

    @Test
    @DisplayName("Should report ACTIVE when busy and IDLE only after the idle timeout")
    void testState_ActiveThenIdle() {
        probe.set(40.0, 10.0);
        monitor.sample(true);
        assertEquals(MonitorState.ACTIVE, monitor.state());

        probe.set(5.0, 10.0);
        clock.advance(Duration.ofSeconds(10));
        monitor.sample(true);
        assertEquals(MonitorState.ACTIVE, monitor.state());

        clock.advance(properties.getIdleTimeout());
        monitor.sample(true);
        assertEquals(MonitorState.IDLE, monitor.state());
    }

    @Test
    @DisplayName("Should stay out of IDLE while work is registered")
    void testRegisterWork_PreventsIdle() {
        monitor.registerWork("job-1");
        assertEquals(MonitorState.ACTIVE, monitor.state());

        clock.advance(Duration.ofMinutes(5));
        monitor.sample(true);
        assertEquals(MonitorState.ACTIVE, monitor.state());
        assertEquals(1, monitor.activeWorkCount());

        monitor.unregisterWork("job-1");
        clock.advance(Duration.ofMinutes(1));
        monitor.sample(true);
        assertEquals(MonitorState.IDLE, monitor.state());
    }

    // ============================================================================
    // Listeners
    // ============================================================================

    @Test
    @DisplayName("Should notify state listeners once per transition")
    void testStateListener_EdgeTriggered() {
        List<MonitorState> seen = new ArrayList<>();
        monitor.addStateListener((previous, current, sample) -> seen.add(current));

        probe.set(95.0, 10.0);
        monitor.sample(true);
        monitor.sample(true);
        monitor.sample(true);
        probe.set(40.0, 10.0);
        monitor.sample(true);

        assertEquals(List.of(MonitorState.CRITICAL, MonitorState.ACTIVE), seen);
        assertEquals(2, monitor.stats().getStateTransitions());
    }

    @Test
    @DisplayName("Should keep notifying when one listener throws")
    void testStateListener_FailureIsolated() {
        List<MonitorState> seen = new ArrayList<>();
        monitor.addStateListener((previous, current, sample) -> {
            throw new IllegalStateException("listener bug");
        });
        monitor.addStateListener((previous, current, sample) -> seen.add(current));

        probe.set(95.0, 10.0);
        monitor.sample(true);

        assertEquals(List.of(MonitorState.CRITICAL), seen);
    }

    @Test
    @DisplayName("Should hand every fresh sample to sample listeners, past a failing one")
    void testSampleListener_FreshSamplesOnly() {
        List<ResourceSample> seen = new ArrayList<>();
        monitor.addSampleListener(sample -> {
            throw new IllegalStateException("listener bug");
        });
        monitor.addSampleListener(seen::add);

        probe.set(42.0, 12.0);
        ResourceSample first = monitor.sample(true);
        monitor.sample();
        probe.set(95.0, 12.0);
        ResourceSample second = monitor.sample(true);

        assertEquals(List.of(first, second), seen);
        assertEquals(MonitorState.CRITICAL, monitor.state());
    }

    @Test
    @DisplayName("Should feed the host usage gauges from a sample listener")
    void testSampleListener_FeedsGauges() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsCollector metrics = new MetricsCollector(registry);
        monitor.addSampleListener(sample -> metrics.recordResourceSample(sample.cpuPercent(), sample.memPercent()));

        probe.set(37.5, 21.0);
        monitor.sample(true);

        assertEquals(37.5, registry.get("taskpilot.monitor.cpu.percent").gauge().value(), 1e-9);
        assertEquals(21.0, registry.get("taskpilot.monitor.mem.percent").gauge().value(), 1e-9);
    }

    // ============================================================================
    // Sampling, headroom and queries
    // ============================================================================

    @Test
    @DisplayName("Should serve the cached sample within the TTL")
    void testSample_Cached() {
        monitor.sample();
        monitor.sample();
        assertEquals(1, probe.reads());

        clock.advance(properties.getCacheTtl());
        monitor.sample();
        assertEquals(2, probe.reads());
    }

    @Test
    @DisplayName("Should fall back to the last sample when the probe fails")
    void testSample_ProbeFailure() {
        probe.set(42.0, 12.0);
        ResourceSample good = monitor.sample(true);

        probe.setFailing(true);
        ResourceSample fallback = monitor.sample(true);
        assertSame(good, fallback);
    }

    @Test
    @DisplayName("Should return an all-zero sample when the probe fails before any reading")
    void testSample_ProbeFailureWithoutHistory() {
        probe.setFailing(true);
        ResourceSample s = monitor.sample(true);
        assertEquals(0.0, s.cpuPercent());
        assertEquals(0.0, s.memPercent());
    }

    @Test
    @DisplayName("Should compute headroom against the ceilings")
    void testHeadroomAndCanStartWork() {
        probe.set(60.0, 50.0);
        Headroom h = monitor.headroom();
        assertEquals(20.0, h.cpu(), 1e-9);
        assertEquals(20.0, h.mem(), 1e-9);
        assertTrue(monitor.canStartWork(10.0, 5.0));
        assertFalse(monitor.canStartWork(25.0, 5.0));
        assertTrue(monitor.isSafe());
    }

    @Test
    @DisplayName("Should suggest longer start delays in more severe states")
    void testSuggestStartDelay() {
        assertEquals(Duration.ZERO, monitor.suggestStartDelay());
        probe.set(95.0, 10.0);
        monitor.sample(true);
        assertEquals(Duration.ofSeconds(5), monitor.suggestStartDelay());
    }

    @Test
    @DisplayName("Should poll faster in more severe states")
    void testPollInterval_ByState() {
        assertEquals(properties.getPollInterval().getIdle(), monitor.pollInterval());
        probe.set(95.0, 10.0);
        monitor.sample(true);
        assertEquals(properties.getPollInterval().getCritical(), monitor.pollInterval());
    }

    @Test
    @DisplayName("Should reject polling intervals that do not shrink with severity")
    void testConstructor_InvalidIntervals() {
        ResourceMonitorProperties bad = new ResourceMonitorProperties();
        bad.getPollInterval().setCritical(Duration.ofSeconds(10));
        assertThrows(IllegalArgumentException.class, () -> new ResourceMonitor(probe, bad, clock));
    }

    @Test
    @DisplayName("Should report a rising CPU trend")
    void testTrend_Rising() {
        for (int i = 0; i < 4; i++) {
            probe.set(10.0, 10.0);
            monitor.sample(true);
        }
        for (int i = 0; i < 4; i++) {
            probe.set(40.0, 10.0);
            monitor.sample(true);
        }
        ResourceTrend trend = monitor.trend();
        assertEquals(ResourceTrend.Direction.RISING, trend.cpu());
        assertEquals(ResourceTrend.Direction.STABLE, trend.mem());
        assertEquals(8, trend.samples());
    }
}
