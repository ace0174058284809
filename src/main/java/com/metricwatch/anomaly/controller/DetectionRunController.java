package com.metricwatch.anomaly.controller;

import com.metricwatch.anomaly.model.DetectionRun;
import com.metricwatch.anomaly.repository.DetectionRunRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/anomaly-runs")
@Tag(name = "Detection Runs", description = "Inspect detection run records")
public class DetectionRunController {

    private final DetectionRunRepository runRepository;

    public DetectionRunController(DetectionRunRepository runRepository) {
        this.runRepository = runRepository;
    }

    @Operation(summary = "Recent runs for an organization", description = "Newest first.")
    @GetMapping
    public ResponseEntity<List<DetectionRun>> listRuns(
            @RequestHeader("X-Organization-Id") String organizationId,
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(runRepository.findRecent(organizationId, limit));
    }

    @Operation(summary = "Get a run by ID")
    @GetMapping("/{runId}")
    public ResponseEntity<DetectionRun> getRun(
            @Parameter(description = "Run ID", example = "run-1") @PathVariable String runId,
            @RequestHeader("X-Organization-Id") String organizationId) {
        DetectionRun run = runRepository.findById(runId);
        if (run == null || !organizationId.equals(run.getOrganizationId())) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(run);
    }
}
