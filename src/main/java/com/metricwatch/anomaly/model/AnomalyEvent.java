package com.metricwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyEvent {

    private String eventId;
    private AnomalyEventType type;
    private String organizationId;
    private String userId;
    private String timestamp;
    private Map<String, Object> data;
}
