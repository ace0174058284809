package com.metricwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Statistical methods available to a detection configuration.
 * Configurations store the lower-case code; the engine resolves it here.
 */
public enum DetectionMethod {
    ZSCORE("zscore"),
    IQR("iqr"),
    MOVING_AVERAGE("moving_average");

    private final String code;

    DetectionMethod(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Optional<DetectionMethod> fromCode(String code) {
        if (code == null) return Optional.empty();
        for (DetectionMethod method : values()) {
            if (method.code.equalsIgnoreCase(code.trim())) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
