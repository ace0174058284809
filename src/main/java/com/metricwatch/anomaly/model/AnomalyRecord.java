package com.metricwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A persisted anomaly produced by a detection run")
public class AnomalyRecord {

    @Schema(description = "Anomaly ID", example = "a1")
    private String id;

    @Schema(description = "Owning organization", example = "org-1")
    private String organizationId;

    @Schema(description = "Source connection", example = "conn-1")
    private String connectionId;

    @Schema(description = "Configuration that produced the anomaly", example = "cfg-1")
    private String configId;

    @Schema(description = "Detection run that produced the anomaly", example = "run-1")
    private String runId;

    @Schema(description = "Table name", example = "orders")
    private String tableName;

    @Schema(description = "Column name", example = "amount")
    private String columnName;

    @Schema(description = "Metric name", example = "row_count")
    private String metricName;

    @Schema(description = "Anomalous metric value", example = "100.0")
    private double metricValue;

    @Schema(description = "Timestamp of the anomalous metric point", example = "2024-05-08T00:00:00Z")
    private String metricTimestamp;

    @Schema(description = "Detection method code", example = "zscore")
    private String method;

    @Schema(description = "Severity tier", example = "high")
    private Severity severity;

    @Schema(description = "Anomaly score", example = "5.3")
    private double score;

    @Schema(description = "Threshold in force when detected", example = "3.0")
    private double threshold;

    @Schema(description = "Detection time in epoch milliseconds", example = "1714521600000")
    private long detectedAt;

    @Schema(description = "Review status", example = "open")
    @Builder.Default
    private AnomalyStatus status = AnomalyStatus.OPEN;

    @Schema(description = "Free-text note recorded when the status changed")
    private String resolutionNote;

    @Schema(description = "Resolution time in epoch milliseconds (0 while unresolved)", example = "0")
    private long resolvedAt;

    @Schema(description = "User that resolved the anomaly")
    private String resolvedBy;
}
