package com.metricwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String code;

    RunStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static RunStatus fromCode(String code) {
        for (RunStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + code);
    }
}
