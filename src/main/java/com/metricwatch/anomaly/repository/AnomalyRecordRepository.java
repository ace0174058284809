package com.metricwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.metricwatch.anomaly.config.AerospikeConfig;
import com.metricwatch.anomaly.model.AnomalyRecord;
import com.metricwatch.anomaly.model.AnomalyStatus;
import com.metricwatch.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class AnomalyRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRecordRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AnomalyRecordRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * Insert a batch of anomalies. A failing write aborts the rest of this batch
     * and propagates to the caller.
     */
    public void saveBatch(List<AnomalyRecord> records) {
        for (AnomalyRecord record : records) {
            save(record);
        }
    }

    public void save(AnomalyRecord anomaly) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_RESULTS, anomaly.getId());

        client.put(writePolicy, key,
                new Bin("id", anomaly.getId()),
                new Bin("organizationId", anomaly.getOrganizationId()),
                new Bin("connectionId", anomaly.getConnectionId()),
                new Bin("configId", anomaly.getConfigId()),
                new Bin("runId", anomaly.getRunId()),
                new Bin("tableName", anomaly.getTableName()),
                new Bin("columnName", anomaly.getColumnName()),
                new Bin("metricName", anomaly.getMetricName()),
                new Bin("metricValue", anomaly.getMetricValue()),
                new Bin("metricTs", anomaly.getMetricTimestamp()),
                new Bin("method", anomaly.getMethod()),
                new Bin("severity", anomaly.getSeverity().getCode()),
                new Bin("score", anomaly.getScore()),
                new Bin("threshold", anomaly.getThreshold()),
                new Bin("detectedAt", anomaly.getDetectedAt()),
                new Bin("status", anomaly.getStatus().getCode()),
                new Bin("resolutionNote", anomaly.getResolutionNote()),
                new Bin("resolvedAt", anomaly.getResolvedAt()),
                new Bin("resolvedBy", anomaly.getResolvedBy()));
    }

    public AnomalyRecord findById(String anomalyId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_RESULTS, anomalyId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Anomalies detected for a connection since the given time, newest first.
     */
    public List<AnomalyRecord> findByConnection(String organizationId, String connectionId,
                                                String tableName, AnomalyStatus status,
                                                long sinceEpochMs, int limit) {
        List<AnomalyRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_RESULTS,
                (key, record) -> {
                    try {
                        if (!organizationId.equals(record.getString("organizationId"))) return;
                        if (!connectionId.equals(record.getString("connectionId"))) return;
                        if (tableName != null && !tableName.equals(record.getString("tableName"))) return;
                        if (status != null && !status.getCode().equals(record.getString("status"))) return;
                        if (record.getLong("detectedAt") < sinceEpochMs) return;

                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read anomaly record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(AnomalyRecord::getDetectedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    public void updateStatus(String anomalyId, AnomalyStatus status, String resolutionNote,
                             long resolvedAt, String resolvedBy) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_RESULTS, anomalyId);

        client.put(writePolicy, key,
                new Bin("status", status.getCode()),
                new Bin("resolutionNote", resolutionNote),
                new Bin("resolvedAt", resolvedAt),
                new Bin("resolvedBy", resolvedBy));
    }

    private AnomalyRecord mapRecord(Record record) {
        return AnomalyRecord.builder()
                .id(record.getString("id"))
                .organizationId(record.getString("organizationId"))
                .connectionId(record.getString("connectionId"))
                .configId(record.getString("configId"))
                .runId(record.getString("runId"))
                .tableName(record.getString("tableName"))
                .columnName(record.getString("columnName"))
                .metricName(record.getString("metricName"))
                .metricValue(record.getDouble("metricValue"))
                .metricTimestamp(record.getString("metricTs"))
                .method(record.getString("method"))
                .severity(Severity.fromCode(record.getString("severity")))
                .score(record.getDouble("score"))
                .threshold(record.getDouble("threshold"))
                .detectedAt(record.getLong("detectedAt"))
                .status(AnomalyStatus.fromCode(record.getString("status")).orElse(AnomalyStatus.OPEN))
                .resolutionNote(record.getString("resolutionNote"))
                .resolvedAt(record.getLong("resolvedAt"))
                .resolvedBy(record.getString("resolvedBy"))
                .build();
    }
}
