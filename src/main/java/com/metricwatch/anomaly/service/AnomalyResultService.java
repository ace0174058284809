package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.model.AnomalyEventType;
import com.metricwatch.anomaly.model.AnomalyRecord;
import com.metricwatch.anomaly.model.AnomalyStatus;
import com.metricwatch.anomaly.model.Severity;
import com.metricwatch.anomaly.repository.AnomalyRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
public class AnomalyResultService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyResultService.class);

    public static final int DEFAULT_DAYS = 30;
    public static final int DEFAULT_LIMIT = 100;

    // Large enough to cover every anomaly of a summary window
    private static final int SUMMARY_SCAN_LIMIT = 10_000;

    private final AnomalyRecordRepository anomalyRecordRepository;
    private final AnomalyEventPublisher eventPublisher;

    public AnomalyResultService(AnomalyRecordRepository anomalyRecordRepository,
                                AnomalyEventPublisher eventPublisher) {
        this.anomalyRecordRepository = anomalyRecordRepository;
        this.eventPublisher = eventPublisher;
    }

    public List<AnomalyRecord> getAnomalies(String organizationId, String connectionId, String tableName,
                                            AnomalyStatus status, int days, int limit) {
        return anomalyRecordRepository.findByConnection(organizationId, connectionId, tableName, status,
                since(days), limit);
    }

    public AnomalyRecord getAnomaly(String organizationId, String anomalyId) {
        AnomalyRecord anomaly = anomalyRecordRepository.findById(anomalyId);
        if (anomaly == null || !organizationId.equals(anomaly.getOrganizationId())) {
            return null;
        }
        return anomaly;
    }

    /**
     * Move an anomaly to a new review status.
     *
     * @return the updated anomaly, or null if it does not exist
     * @throws IllegalArgumentException if the status code is not recognized
     */
    public AnomalyRecord updateStatus(String organizationId, String userId, String anomalyId,
                                      String statusCode, String note) {
        AnomalyStatus status = AnomalyStatus.fromCode(statusCode)
                .orElseThrow(() -> new IllegalArgumentException("Invalid status: " + statusCode));

        AnomalyRecord anomaly = getAnomaly(organizationId, anomalyId);
        if (anomaly == null) {
            return null;
        }

        boolean resolved = status == AnomalyStatus.RESOLVED;
        long resolvedAt = resolved ? System.currentTimeMillis() : 0L;
        String resolvedBy = resolved ? userId : null;
        anomalyRecordRepository.updateStatus(anomalyId, status, note, resolvedAt, resolvedBy);

        anomaly.setStatus(status);
        anomaly.setResolutionNote(note);
        anomaly.setResolvedAt(resolvedAt);
        anomaly.setResolvedBy(resolvedBy);
        log.info("Anomaly {} moved to {} by {}", anomalyId, status.getCode(), userId);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("anomaly_id", anomalyId);
        data.put("connection_id", anomaly.getConnectionId());
        data.put("config_id", anomaly.getConfigId());
        data.put("status", status.getCode());
        data.put("resolution_note", note);
        eventPublisher.publish(resolved ? AnomalyEventType.ANOMALY_RESOLVED : AnomalyEventType.ANOMALY_ACKNOWLEDGED,
                data, organizationId, userId);

        return anomaly;
    }

    /**
     * Totals over the window: overall count, per severity, per status and per table.
     */
    public Map<String, Object> getSummary(String organizationId, String connectionId, int days) {
        List<AnomalyRecord> anomalies = anomalyRecordRepository.findByConnection(organizationId, connectionId,
                null, null, since(days), SUMMARY_SCAN_LIMIT);

        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity.getCode(), 0);
        }
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (AnomalyStatus status : AnomalyStatus.values()) {
            byStatus.put(status.getCode(), 0);
        }
        Map<String, Integer> byTable = new TreeMap<>();

        for (AnomalyRecord anomaly : anomalies) {
            if (anomaly.getSeverity() != null) {
                bySeverity.merge(anomaly.getSeverity().getCode(), 1, Integer::sum);
            }
            if (anomaly.getStatus() != null) {
                byStatus.merge(anomaly.getStatus().getCode(), 1, Integer::sum);
            }
            if (anomaly.getTableName() != null) {
                byTable.merge(anomaly.getTableName(), 1, Integer::sum);
            }
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("days", days);
        summary.put("total", anomalies.size());
        summary.put("bySeverity", bySeverity);
        summary.put("byStatus", byStatus);
        summary.put("byTable", byTable);
        return summary;
    }

    private static long since(int days) {
        return System.currentTimeMillis() - Duration.ofDays(Math.max(0, days)).toMillis();
    }
}
