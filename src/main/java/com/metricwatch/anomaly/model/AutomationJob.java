package com.metricwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutomationJob {

    private String jobId;
    private String organizationId;
    private String connectionId;
    private String jobType;
    private String trigger;
    private JobStatus status;
    private long createdAt;
    private long updatedAt;
}
