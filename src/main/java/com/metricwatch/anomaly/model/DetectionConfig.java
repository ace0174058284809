package com.metricwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Binds one metric to a detection policy. Optional fields are left null until
 * {@code AnomalyDetector.validateConfig} fills their defaults.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anomaly detection configuration for a single metric")
public class DetectionConfig {

    @Schema(description = "Configuration ID", example = "cfg-1")
    private String id;

    @Schema(description = "Owning organization", example = "org-1")
    private String organizationId;

    @Schema(description = "Source database connection", example = "conn-1")
    private String connectionId;

    @Schema(description = "Monitored table", example = "orders")
    private String tableName;

    @Schema(description = "Monitored column (optional)", example = "amount")
    private String columnName;

    @Schema(description = "Monitored metric", example = "row_count")
    private String metricName;

    @Schema(description = "Detection method", example = "zscore", allowableValues = {"zscore", "iqr", "moving_average"})
    private String detectionMethod;

    @Schema(description = "Divisor of the method's base threshold. Higher values lower the threshold", example = "1.0")
    private Double sensitivity;

    @Schema(description = "Minimum number of points required before detection runs", example = "7")
    private Integer minDataPoints;

    @Schema(description = "Baseline lookback in days (history fetch is never shorter than 30 days)", example = "14")
    private Integer baselineWindowDays;

    @Schema(description = "Method-specific parameters", example = "{\"window\": 7, \"std_window\": 7}")
    private Map<String, Object> configParams;

    @Schema(description = "Whether the configuration takes part in detection runs", example = "true")
    private Boolean active;

    @Schema(description = "User that created the configuration", example = "user-1")
    private String createdBy;

    @Schema(description = "Creation time in epoch milliseconds", example = "1714521600000")
    private long createdAt;

    @Schema(description = "Last update time in epoch milliseconds", example = "1714521600000")
    private long updatedAt;

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }

    /**
     * Reads an integer parameter from {@link #configParams}, accepting any numeric
     * or numeric-text value. Returns null when absent or unparseable.
     */
    public Integer getParamAsInteger(String key) {
        if (configParams == null) return null;
        Object val = configParams.get(key);
        if (val == null) return null;
        if (val instanceof Number number) {
            return number.intValue();
        }
        try {
            return (int) Double.parseDouble(val.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
