package com.metricwatch.anomaly.controller;

import com.metricwatch.anomaly.model.AnomalyRecord;
import com.metricwatch.anomaly.model.AnomalyStatus;
import com.metricwatch.anomaly.model.JobTriggerResult;
import com.metricwatch.anomaly.model.StatusUpdateRequest;
import com.metricwatch.anomaly.model.TriggerType;
import com.metricwatch.anomaly.service.AnomalyResultService;
import com.metricwatch.anomaly.service.DetectionJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/connections/{connectionId}/anomalies")
@Tag(name = "Anomalies", description = "Browse detected anomalies, review them and trigger manual runs")
public class AnomalyController {

    private final AnomalyResultService resultService;
    private final DetectionJobService jobService;

    public AnomalyController(AnomalyResultService resultService, DetectionJobService jobService) {
        this.resultService = resultService;
        this.jobService = jobService;
    }

    @Operation(summary = "List anomalies for a connection",
            description = "Newest first. Filters by table and review status are optional.")
    @GetMapping
    public ResponseEntity<List<AnomalyRecord>> listAnomalies(
            @Parameter(description = "Connection ID", example = "conn-1") @PathVariable String connectionId,
            @RequestHeader("X-Organization-Id") String organizationId,
            @RequestParam(required = false) String tableName,
            @Parameter(description = "open, acknowledged, resolved or expected")
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "30") int days,
            @RequestParam(defaultValue = "100") int limit) {
        AnomalyStatus statusFilter = null;
        if (status != null) {
            statusFilter = AnomalyStatus.fromCode(status).orElse(null);
            if (statusFilter == null) {
                return ResponseEntity.badRequest().build();
            }
        }
        return ResponseEntity.ok(resultService.getAnomalies(organizationId, connectionId, tableName,
                statusFilter, days, limit));
    }

    @Operation(summary = "Anomaly summary",
            description = "Counts by severity, status and table over the last N days.")
    @GetMapping("/summary")
    public ResponseEntity<Map<String, Object>> getSummary(
            @Parameter(description = "Connection ID", example = "conn-1") @PathVariable String connectionId,
            @RequestHeader("X-Organization-Id") String organizationId,
            @RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(resultService.getSummary(organizationId, connectionId, days));
    }

    @Operation(summary = "Get a single anomaly")
    @GetMapping("/{anomalyId}")
    public ResponseEntity<AnomalyRecord> getAnomaly(
            @Parameter(description = "Connection ID", example = "conn-1") @PathVariable String connectionId,
            @Parameter(description = "Anomaly ID", example = "a1") @PathVariable String anomalyId,
            @RequestHeader("X-Organization-Id") String organizationId) {
        AnomalyRecord anomaly = resultService.getAnomaly(organizationId, anomalyId);
        if (anomaly == null || !connectionId.equals(anomaly.getConnectionId())) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(anomaly);
    }

    @Operation(summary = "Update the review status of an anomaly",
            description = "Resolving stamps the resolution time and user.")
    @PutMapping("/{anomalyId}/status")
    public ResponseEntity<AnomalyRecord> updateStatus(
            @Parameter(description = "Connection ID", example = "conn-1") @PathVariable String connectionId,
            @Parameter(description = "Anomaly ID", example = "a1") @PathVariable String anomalyId,
            @RequestHeader("X-Organization-Id") String organizationId,
            @RequestHeader(value = "X-User-Id", required = false) String userId,
            @RequestBody StatusUpdateRequest request) {
        if (request.getStatus() == null) {
            return ResponseEntity.badRequest().build();
        }
        AnomalyRecord existing = resultService.getAnomaly(organizationId, anomalyId);
        if (existing == null || !connectionId.equals(existing.getConnectionId())) {
            return ResponseEntity.notFound().build();
        }
        try {
            AnomalyRecord updated = resultService.updateStatus(organizationId, userId, anomalyId,
                    request.getStatus(), request.getNote());
            if (updated == null) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(updated);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Run anomaly detection now",
            description = "Runs every active config of the connection. Returns 409 while an identical job is active.")
    @PostMapping("/run")
    public ResponseEntity<JobTriggerResult> runDetection(
            @Parameter(description = "Connection ID", example = "conn-1") @PathVariable String connectionId,
            @RequestHeader("X-Organization-Id") String organizationId) {
        JobTriggerResult result = jobService.trigger(organizationId, connectionId, TriggerType.MANUAL);
        if (!result.isAccepted()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
        }
        if (result.getSummary() != null && !result.getSummary().isSuccess()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
        return ResponseEntity.ok(result);
    }
}
