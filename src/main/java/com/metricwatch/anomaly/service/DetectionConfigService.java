package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.engine.AnomalyDetector;
import com.metricwatch.anomaly.model.AnomalyEventType;
import com.metricwatch.anomaly.model.DetectionConfig;
import com.metricwatch.anomaly.model.DetectionMethod;
import com.metricwatch.anomaly.repository.DetectionConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class DetectionConfigService {

    private static final Logger log = LoggerFactory.getLogger(DetectionConfigService.class);

    private final DetectionConfigRepository configRepository;
    private final AnomalyDetector detector;
    private final AnomalyEventPublisher eventPublisher;

    public DetectionConfigService(DetectionConfigRepository configRepository,
                                  AnomalyDetector detector,
                                  AnomalyEventPublisher eventPublisher) {
        this.configRepository = configRepository;
        this.detector = detector;
        this.eventPublisher = eventPublisher;
    }

    public List<DetectionConfig> getConfigs(String organizationId, String connectionId,
                                            String tableName, String metricName) {
        return configRepository.findByConnection(organizationId, connectionId, tableName, metricName);
    }

    /**
     * @return the configuration, or null if it does not exist in this organization
     */
    public DetectionConfig getConfig(String organizationId, String configId) {
        DetectionConfig config = configRepository.findById(configId);
        if (config == null || !organizationId.equals(config.getOrganizationId())) {
            return null;
        }
        return config;
    }

    public DetectionConfig createConfig(String organizationId, String userId, DetectionConfig request) {
        requireKnownMethod(request.getDetectionMethod());
        requireText(request.getConnectionId(), "connectionId");
        requireText(request.getMetricName(), "metricName");

        DetectionConfig config = detector.validateConfig(request);
        requireUsableThresholds(config);
        long now = System.currentTimeMillis();
        if (config.getId() == null || config.getId().isBlank()) {
            config.setId(UUID.randomUUID().toString());
        }
        config.setOrganizationId(organizationId);
        config.setCreatedBy(userId);
        config.setCreatedAt(now);
        config.setUpdatedAt(now);
        if (config.getActive() == null) {
            config.setActive(true);
        }

        configRepository.save(config);
        log.info("Created anomaly detection config {} for {}.{}", config.getId(),
                config.getTableName(), config.getMetricName());

        eventPublisher.publish(AnomalyEventType.ANOMALY_CONFIG_CREATED, eventData(config), organizationId, userId);
        return config;
    }

    /**
     * Merge the non-null fields of {@code patch} onto the stored configuration.
     *
     * @return the updated configuration, or null if it does not exist
     */
    public DetectionConfig updateConfig(String organizationId, String userId, String configId, DetectionConfig patch) {
        DetectionConfig existing = getConfig(organizationId, configId);
        if (existing == null) {
            return null;
        }
        if (patch.getDetectionMethod() != null) {
            requireKnownMethod(patch.getDetectionMethod());
        }

        DetectionConfig.DetectionConfigBuilder merged = existing.toBuilder();
        if (patch.getTableName() != null) merged.tableName(patch.getTableName());
        if (patch.getColumnName() != null) merged.columnName(patch.getColumnName());
        if (patch.getMetricName() != null) merged.metricName(patch.getMetricName());
        if (patch.getDetectionMethod() != null) merged.detectionMethod(patch.getDetectionMethod());
        if (patch.getSensitivity() != null) merged.sensitivity(patch.getSensitivity());
        if (patch.getMinDataPoints() != null) merged.minDataPoints(patch.getMinDataPoints());
        if (patch.getBaselineWindowDays() != null) merged.baselineWindowDays(patch.getBaselineWindowDays());
        if (patch.getConfigParams() != null) merged.configParams(patch.getConfigParams());
        if (patch.getActive() != null) merged.active(patch.getActive());

        DetectionConfig updated = detector.validateConfig(merged.build());
        requireUsableThresholds(updated);
        updated.setUpdatedAt(System.currentTimeMillis());

        configRepository.save(updated);
        log.info("Updated anomaly detection config {}", configId);

        eventPublisher.publish(AnomalyEventType.ANOMALY_CONFIG_UPDATED, eventData(updated), organizationId, userId);
        return updated;
    }

    public boolean deleteConfig(String organizationId, String userId, String configId) {
        DetectionConfig existing = getConfig(organizationId, configId);
        if (existing == null) {
            return false;
        }

        boolean deleted = configRepository.delete(configId);
        if (deleted) {
            Map<String, Object> data = eventData(existing);
            data.put("deleted", true);
            eventPublisher.publish(AnomalyEventType.ANOMALY_CONFIG_UPDATED, data, organizationId, userId);
            log.info("Deleted anomaly detection config {}", configId);
        }
        return deleted;
    }

    // Runs against the defaulted config, so only explicitly supplied values can fail
    private static void requireUsableThresholds(DetectionConfig config) {
        Double sensitivity = config.getSensitivity();
        if (sensitivity == null || !(sensitivity > 0.0) || sensitivity.isInfinite()) {
            throw new IllegalArgumentException("sensitivity must be a positive number: " + sensitivity);
        }
        if (config.getMinDataPoints() == null || config.getMinDataPoints() < 1) {
            throw new IllegalArgumentException("minDataPoints must be at least 1: " + config.getMinDataPoints());
        }
        if (config.getBaselineWindowDays() == null || config.getBaselineWindowDays() < 1) {
            throw new IllegalArgumentException("baselineWindowDays must be at least 1: " + config.getBaselineWindowDays());
        }
    }

    private static void requireKnownMethod(String method) {
        if (method != null && DetectionMethod.fromCode(method).isEmpty()) {
            throw new IllegalArgumentException("Unknown detection method: " + method);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    private static Map<String, Object> eventData(DetectionConfig config) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("config_id", config.getId());
        data.put("connection_id", config.getConnectionId());
        data.put("table_name", config.getTableName());
        data.put("column_name", config.getColumnName());
        data.put("metric_name", config.getMetricName());
        data.put("detection_method", config.getDetectionMethod());
        data.put("is_active", config.isActive());
        return data;
    }
}
