package com.metricwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.Value;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricwatch.anomaly.config.AerospikeConfig;
import com.metricwatch.anomaly.model.DetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

@Repository
public class DetectionConfigRepository {

    private static final Logger log = LoggerFactory.getLogger(DetectionConfigRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public DetectionConfigRepository(AerospikeClient client,
                                     @Qualifier("aerospikeNamespace") String namespace,
                                     @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                     @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(DetectionConfig config) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_CONFIGS, config.getId());

        client.put(writePolicy, key,
                new Bin("id", config.getId()),
                new Bin("organizationId", config.getOrganizationId()),
                new Bin("connectionId", config.getConnectionId()),
                new Bin("tableName", config.getTableName()),
                new Bin("columnName", config.getColumnName()),
                new Bin("metricName", config.getMetricName()),
                new Bin("detectionMethod", config.getDetectionMethod()),
                new Bin("sensitivity", Value.get(config.getSensitivity())),
                new Bin("minDataPoints", Value.get(config.getMinDataPoints())),
                new Bin("baselineDays", Value.get(config.getBaselineWindowDays())),
                new Bin("configParams", serializeParams(config.getConfigParams())),
                new Bin("active", config.isActive()),
                new Bin("createdBy", config.getCreatedBy()),
                new Bin("createdAt", config.getCreatedAt()),
                new Bin("updatedAt", config.getUpdatedAt()));
    }

    public DetectionConfig findById(String configId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_CONFIGS, configId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public boolean delete(String configId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_CONFIGS, configId);
        return client.delete(writePolicy, key);
    }

    /**
     * Active configurations of an organization, optionally narrowed to one connection.
     */
    public List<DetectionConfig> findActive(String organizationId, String connectionId) {
        return scan(config -> config.isActive()
                && organizationId.equals(config.getOrganizationId())
                && (connectionId == null || connectionId.equals(config.getConnectionId())));
    }

    public List<DetectionConfig> findByConnection(String organizationId, String connectionId,
                                                  String tableName, String metricName) {
        return scan(config -> organizationId.equals(config.getOrganizationId())
                && connectionId.equals(config.getConnectionId())
                && (tableName == null || tableName.equals(config.getTableName()))
                && (metricName == null || metricName.equals(config.getMetricName())));
    }

    /**
     * Active configurations of any organization updated at or after the given time.
     */
    public List<DetectionConfig> findActiveUpdatedSince(long sinceEpochMs) {
        return scan(config -> config.isActive() && config.getUpdatedAt() >= sinceEpochMs);
    }

    private List<DetectionConfig> scan(Predicate<DetectionConfig> filter) {
        List<DetectionConfig> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_CONFIGS,
                (key, record) -> {
                    try {
                        DetectionConfig config = mapRecord(record);
                        if (filter.test(config)) {
                            synchronized (results) {
                                results.add(config);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize detection config record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private DetectionConfig mapRecord(Record record) {
        return DetectionConfig.builder()
                .id(record.getString("id"))
                .organizationId(record.getString("organizationId"))
                .connectionId(record.getString("connectionId"))
                .tableName(record.getString("tableName"))
                .columnName(record.getString("columnName"))
                .metricName(record.getString("metricName"))
                .detectionMethod(record.getString("detectionMethod"))
                .sensitivity(asDouble(record.getValue("sensitivity")))
                .minDataPoints(asInteger(record.getValue("minDataPoints")))
                .baselineWindowDays(asInteger(record.getValue("baselineDays")))
                .configParams(deserializeParams(record.getString("configParams")))
                .active(record.getBoolean("active"))
                .createdBy(record.getString("createdBy"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }

    private static Double asDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }

    private static Integer asInteger(Object value) {
        return value instanceof Number number ? number.intValue() : null;
    }

    private String serializeParams(Map<String, Object> params) {
        try {
            return objectMapper.writeValueAsString(params == null ? Map.of() : params);
        } catch (Exception e) {
            log.error("Failed to serialize config params", e);
            return "{}";
        }
    }

    private Map<String, Object> deserializeParams(String json) {
        if (json == null || json.isEmpty()) return new HashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize config params", e);
            return new HashMap<>();
        }
    }
}
