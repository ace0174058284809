package com.metricwatch.anomaly.testutil;

import com.metricwatch.anomaly.model.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final String ORG = "org-1";
    public static final String CONN = "conn-1";

    private static final Instant BASE_TIME = Instant.parse("2024-05-01T00:00:00Z");

    private TestDataFactory() {}

    public static DetectionConfig createConfig(String id, String metricName, String method) {
        return DetectionConfig.builder()
                .id(id)
                .organizationId(ORG)
                .connectionId(CONN)
                .tableName("orders")
                .metricName(metricName)
                .detectionMethod(method)
                .sensitivity(1.0)
                .minDataPoints(7)
                .baselineWindowDays(14)
                .configParams(new HashMap<>())
                .active(true)
                .createdAt(System.currentTimeMillis())
                .updatedAt(System.currentTimeMillis())
                .build();
    }

    /**
     * One point per day starting 2024-05-01, in the order given.
     */
    public static List<MetricPoint> createSeries(String metricName, double... values) {
        List<MetricPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(createPoint(metricName, i, values[i]));
        }
        return points;
    }

    public static MetricPoint createPoint(String metricName, int dayOffset, double value) {
        return MetricPoint.builder()
                .id("m-" + metricName + "-" + dayOffset)
                .organizationId(ORG)
                .connectionId(CONN)
                .tableName("orders")
                .metricName(metricName)
                .timestamp(timestamp(dayOffset))
                .metricValue(value)
                .build();
    }

    public static String timestamp(int dayOffset) {
        return BASE_TIME.plus(dayOffset, ChronoUnit.DAYS).toString();
    }

    public static AnomalyRecord createAnomalyRecord(String id, Severity severity, AnomalyStatus status) {
        return AnomalyRecord.builder()
                .id(id)
                .organizationId(ORG)
                .connectionId(CONN)
                .configId("cfg-1")
                .runId("run-1")
                .tableName("orders")
                .metricName("row_count")
                .metricValue(100.0)
                .metricTimestamp(timestamp(7))
                .method("zscore")
                .severity(severity)
                .score(4.2)
                .threshold(3.0)
                .detectedAt(System.currentTimeMillis())
                .status(status)
                .build();
    }

    public static DetectionRun createRun(String runId, RunStatus status) {
        return DetectionRun.builder()
                .runId(runId)
                .organizationId(ORG)
                .connectionId(CONN)
                .triggerType(TriggerType.MANUAL)
                .status(status)
                .startedAt(System.currentTimeMillis())
                .build();
    }
}
