package com.metricwatch.anomaly.controller;

import com.metricwatch.anomaly.service.DetectionJobService;
import com.metricwatch.anomaly.service.SchedulerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "Diagnostics for detection jobs and sweeps")
public class JobController {

    private final DetectionJobService jobService;
    private final SchedulerService schedulerService;

    public JobController(DetectionJobService jobService, SchedulerService schedulerService) {
        this.jobService = jobService;
        this.schedulerService = schedulerService;
    }

    @Operation(summary = "Active deduplicated jobs",
            description = "In-process snapshot only. Not a source of truth for job state.")
    @GetMapping("/active")
    public ResponseEntity<Map<String, Object>> getActiveJobs() {
        return ResponseEntity.ok(jobService.getActiveJobsSummary());
    }

    @Operation(summary = "Sweep schedule", description = "Whether the driver thread runs and when each sweep is next due.")
    @GetMapping("/schedule")
    public ResponseEntity<Map<String, Object>> getSchedule() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", schedulerService.isRunning());
        Map<String, String> next = new LinkedHashMap<>();
        for (Map.Entry<String, Instant> entry : schedulerService.getNextRuns().entrySet()) {
            next.put(entry.getKey(), entry.getValue().toString());
        }
        body.put("nextRuns", next);
        return ResponseEntity.ok(body);
    }
}
