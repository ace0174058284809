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
@Schema(description = "Outcome of a detection run as returned to the caller")
public class RunSummary {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    @Schema(description = "success or error", example = "success")
    private String status;

    @Schema(description = "Run ID (null when the run record could not be created)", example = "run-1")
    private String runId;

    @Schema(description = "Informational message", example = "No active configurations found")
    private String message;

    @Schema(description = "Configurations processed", example = "4")
    private int metricsProcessed;

    @Schema(description = "Anomalies detected", example = "2")
    private int anomaliesDetected;

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
