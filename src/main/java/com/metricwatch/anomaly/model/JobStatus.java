package com.metricwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Live status of an automation job. Only SCHEDULED and RUNNING count as active
 * for duplicate-job checks.
 */
public enum JobStatus {
    SCHEDULED("scheduled"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String code;

    JobStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isActive() {
        return this == SCHEDULED || this == RUNNING;
    }

    @JsonCreator
    public static JobStatus fromCode(String code) {
        for (JobStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + code);
    }
}
