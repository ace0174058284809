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
@Schema(description = "Result of requesting a deduplicated detection job")
public class JobTriggerResult {

    public static final String REASON_DUPLICATE = "duplicate_job";

    @Schema(description = "Whether the job was accepted and executed", example = "true")
    private boolean accepted;

    @Schema(description = "Rejection reason", example = "duplicate_job")
    private String reason;

    @Schema(description = "Human-readable message")
    private String message;

    @Schema(description = "Automation job ID", example = "job-1")
    private String jobId;

    @Schema(description = "Run outcome when the job executed")
    private RunSummary summary;
}
