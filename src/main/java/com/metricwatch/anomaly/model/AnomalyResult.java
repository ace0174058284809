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
@Schema(description = "A detected anomaly joined with its timestamp and value")
public class AnomalyResult {

    @Schema(description = "Position of the point in the evaluated sequence", example = "7")
    private int index;

    @Schema(description = "Timestamp of the anomalous point", example = "2024-05-08T00:00:00Z")
    private String timestamp;

    @Schema(description = "Observed value", example = "100.0")
    private double value;

    @Schema(description = "Method-specific anomaly score", example = "2.65")
    private double score;

    @Schema(description = "Whether the point was flagged as anomalous", example = "true")
    private boolean anomaly;

    @Schema(description = "Score boundary used by the method", example = "3.0")
    private double threshold;

    @Schema(description = "Detection method code", example = "zscore")
    private String method;

    @Schema(description = "Severity tier derived from the score", example = "medium")
    private Severity severity;
}
