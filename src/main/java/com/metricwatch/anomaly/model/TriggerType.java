package com.metricwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TriggerType {
    SCHEDULED("scheduled"),
    MANUAL("manual"),
    EVENT("event");

    private final String code;

    TriggerType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static TriggerType fromCode(String code) {
        for (TriggerType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trigger type: " + code);
    }
}
