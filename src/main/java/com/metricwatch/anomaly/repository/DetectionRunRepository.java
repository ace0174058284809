package com.metricwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.metricwatch.anomaly.config.AerospikeConfig;
import com.metricwatch.anomaly.model.DetectionRun;
import com.metricwatch.anomaly.model.RunStatus;
import com.metricwatch.anomaly.model.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Repository
public class DetectionRunRepository {

    private static final Logger log = LoggerFactory.getLogger(DetectionRunRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public DetectionRunRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * Insert a new run in RUNNING state. A run without a connection gets a random
     * placeholder connection ID.
     */
    public DetectionRun create(String organizationId, String connectionId, TriggerType triggerType) {
        DetectionRun run = DetectionRun.builder()
                .runId(UUID.randomUUID().toString())
                .organizationId(organizationId)
                .connectionId(connectionId != null ? connectionId : UUID.randomUUID().toString())
                .triggerType(triggerType)
                .status(RunStatus.RUNNING)
                .startedAt(System.currentTimeMillis())
                .build();

        Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RUNS, run.getRunId());
        client.put(writePolicy, key,
                new Bin("runId", run.getRunId()),
                new Bin("organizationId", run.getOrganizationId()),
                new Bin("connectionId", run.getConnectionId()),
                new Bin("triggerType", triggerType.getCode()),
                new Bin("status", run.getStatus().getCode()),
                new Bin("startedAt", run.getStartedAt()),
                new Bin("metricsProc", 0),
                new Bin("anomaliesDet", 0),
                new Bin("completedAt", 0L),
                new Bin("execTimeMs", 0L));
        return run;
    }

    /**
     * The single terminal write of a run. Execution time is measured from the
     * stored start time; it falls back to 0 if that cannot be read.
     */
    public void complete(String runId, RunStatus status, int metricsProcessed,
                         int anomaliesDetected, String error) {
        long completedAt = System.currentTimeMillis();
        long executionTimeMs = calculateExecutionTime(runId, completedAt);

        Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RUNS, runId);
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("status", status.getCode()),
                new Bin("metricsProc", metricsProcessed),
                new Bin("anomaliesDet", anomaliesDetected),
                new Bin("completedAt", completedAt),
                new Bin("execTimeMs", executionTimeMs)));
        if (error != null) {
            bins.add(new Bin("error", error));
        }
        client.put(writePolicy, key, bins.toArray(new Bin[0]));
    }

    public DetectionRun findById(String runId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RUNS, runId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<DetectionRun> findRecent(String organizationId, int limit) {
        List<DetectionRun> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DETECTION_RUNS,
                (key, record) -> {
                    try {
                        if (!organizationId.equals(record.getString("organizationId"))) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read detection run record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(DetectionRun::getStartedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private long calculateExecutionTime(String runId, long completedAt) {
        try {
            Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RUNS, runId);
            Record record = client.get(readPolicy, key, "startedAt");
            if (record == null) return 0;
            long startedAt = record.getLong("startedAt");
            return startedAt > 0 ? Math.max(0, completedAt - startedAt) : 0;
        } catch (Exception e) {
            log.error("Error calculating execution time for run {}: {}", runId, e.getMessage());
            return 0;
        }
    }

    private DetectionRun mapRecord(Record record) {
        String status = record.getString("status");
        String trigger = record.getString("triggerType");
        return DetectionRun.builder()
                .runId(record.getString("runId"))
                .organizationId(record.getString("organizationId"))
                .connectionId(record.getString("connectionId"))
                .triggerType(trigger != null ? TriggerType.fromCode(trigger) : null)
                .status(status != null ? RunStatus.fromCode(status) : null)
                .metricsProcessed(record.getInt("metricsProc"))
                .anomaliesDetected(record.getInt("anomaliesDet"))
                .startedAt(record.getLong("startedAt"))
                .completedAt(record.getLong("completedAt"))
                .executionTimeMs(record.getLong("execTimeMs"))
                .error(record.getString("error"))
                .build();
    }
}
