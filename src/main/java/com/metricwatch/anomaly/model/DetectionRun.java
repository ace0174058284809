package com.metricwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One execution of detection across a set of configurations.
 * Goes from RUNNING to exactly one terminal status. Note that
 * anomaliesDetected may exceed metricsProcessed: one configuration can yield
 * several anomalies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Record of a detection run")
public class DetectionRun {

    @Schema(description = "Run ID", example = "run-1")
    private String runId;

    @Schema(description = "Organization", example = "org-1")
    private String organizationId;

    @Schema(description = "Connection in scope (random placeholder when the run covers all connections)", example = "conn-1")
    private String connectionId;

    @Schema(description = "What started the run", example = "scheduled")
    private TriggerType triggerType;

    @Schema(description = "Run status", example = "completed")
    private RunStatus status;

    @Schema(description = "Configurations that produced a detection result", example = "4")
    private int metricsProcessed;

    @Schema(description = "Anomalies found across all configurations", example = "2")
    private int anomaliesDetected;

    @Schema(description = "Start time in epoch milliseconds", example = "1714521600000")
    private long startedAt;

    @Schema(description = "Completion time in epoch milliseconds (0 while running)", example = "1714521601500")
    private long completedAt;

    @Schema(description = "Wall-clock duration", example = "1500")
    private long executionTimeMs;

    @Schema(description = "Failure reason for failed runs")
    private String error;
}
