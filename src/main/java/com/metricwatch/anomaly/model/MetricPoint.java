package com.metricwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One recorded observation of a metric. Produced by the external collector,
 * read-only for the detection engine.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single timestamped metric observation")
public class MetricPoint {

    @Schema(description = "Metric record ID", example = "0b7c7f9e-6f3c-4b7e-9a51-1f2d3c4b5a69")
    private String id;

    @Schema(description = "Owning organization", example = "org-1")
    private String organizationId;

    @Schema(description = "Source database connection", example = "conn-1")
    private String connectionId;

    @Schema(description = "Table the metric describes", example = "orders")
    private String tableName;

    @Schema(description = "Column the metric describes (optional)", example = "amount")
    private String columnName;

    @Schema(description = "Metric name", example = "row_count")
    private String metricName;

    @Schema(description = "Metric category", example = "system")
    @Builder.Default
    private String metricType = "system";

    @Schema(description = "Producer of the metric", example = "system")
    @Builder.Default
    private String source = "system";

    @Schema(description = "ISO-8601 observation time", example = "2024-05-01T00:00:00Z")
    private String timestamp;

    @Schema(description = "Numeric value, when the metric is numeric", example = "1523.0")
    private Double metricValue;

    @Schema(description = "Text value, used when no numeric value was recorded", example = "1523")
    private String metricText;
}
