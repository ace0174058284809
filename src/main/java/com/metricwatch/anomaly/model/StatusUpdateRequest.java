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
@Schema(description = "Review status change for a detected anomaly")
public class StatusUpdateRequest {

    @Schema(description = "New status: open, acknowledged, resolved or expected", example = "resolved")
    private String status;

    @Schema(description = "Optional resolution note", example = "Backfill job re-ran the load")
    private String note;
}
