package com.di.taskpilot.controller;

import com.di.taskpilot.resource.MonitorStats;
import com.di.taskpilot.resource.ResourceMonitor;
import com.di.taskpilot.resource.ResourceTrend;
import com.di.taskpilot.scheduler.PriorityScheduler;
import com.di.taskpilot.scheduler.ScheduledTask;
import com.di.taskpilot.scheduler.SchedulerStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the scheduler and resource monitor, plus cooperative cancel.
 */
@RestController
@RequestMapping("/api/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final PriorityScheduler scheduler;
    private final ResourceMonitor monitor;

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SchedulerStatus> status() {
        return ResponseEntity.ok(scheduler.status());
    }

    @GetMapping(value = "/monitor", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MonitorStats> monitor() {
        return ResponseEntity.ok(monitor.stats());
    }

    @GetMapping(value = "/monitor/trend", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResourceTrend> trend() {
        return ResponseEntity.ok(monitor.trend());
    }

    @GetMapping(value = "/tasks/{taskId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ScheduledTask> task(@PathVariable String taskId) {
        return scheduler.find(taskId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/history", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ScheduledTask>> history() {
        return ResponseEntity.ok(scheduler.history());
    }

    @PostMapping(value = "/tasks/{taskId}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String taskId) {
        boolean cancelled = scheduler.cancel(taskId);
        return ResponseEntity.ok(Map.of("taskId", taskId, "cancelled", cancelled));
    }
}
