package com.metricwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyEventType {
    ANOMALY_DETECTED("anomaly_detected"),
    ANOMALY_RESOLVED("anomaly_resolved"),
    ANOMALY_ACKNOWLEDGED("anomaly_acknowledged"),
    ANOMALY_CONFIG_CREATED("anomaly_config_created"),
    ANOMALY_CONFIG_UPDATED("anomaly_config_updated");

    private final String code;

    AnomalyEventType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
