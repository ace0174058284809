package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.config.MetricsConfig;
import com.metricwatch.anomaly.model.AnomalyEvent;
import com.metricwatch.anomaly.model.AnomalyEventType;
import com.metricwatch.anomaly.repository.AnomalyEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Fire-and-forget event sink. Publishing never throws: failures are logged
 * and reported through the return value only.
 */
@Service
public class AnomalyEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEventPublisher.class);

    private final AnomalyEventRepository eventRepository;
    private final MetricsConfig metricsConfig;

    public AnomalyEventPublisher(AnomalyEventRepository eventRepository, MetricsConfig metricsConfig) {
        this.eventRepository = eventRepository;
        this.metricsConfig = metricsConfig;
    }

    public boolean publish(AnomalyEventType type, Map<String, Object> data,
                           String organizationId, String userId) {
        try {
            AnomalyEvent event = AnomalyEvent.builder()
                    .eventId(UUID.randomUUID().toString())
                    .type(type)
                    .organizationId(organizationId)
                    .userId(userId)
                    .timestamp(Instant.now().toString())
                    .data(data)
                    .build();

            log.info("Anomaly event: {} for organization {}", type.getCode(), organizationId);
            log.debug("Anomaly event payload: {}", event);

            eventRepository.append(event);
            metricsConfig.recordEventPublished(type.getCode(), "success");
            return true;
        } catch (Exception e) {
            metricsConfig.recordEventPublished(type.getCode(), "error");
            log.error("Error publishing anomaly event {}: {}", type.getCode(), e.getMessage(), e);
            return false;
        }
    }
}
