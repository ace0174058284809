package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.config.MetricsConfig;
import com.metricwatch.anomaly.model.AnomalyEvent;
import com.metricwatch.anomaly.model.AnomalyEventType;
import com.metricwatch.anomaly.repository.AnomalyEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyEventPublisherTest {

    @Mock private AnomalyEventRepository eventRepository;
    @Mock private MetricsConfig metricsConfig;

    private AnomalyEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new AnomalyEventPublisher(eventRepository, metricsConfig);
    }

    @Test
    void publish_appendsEventAndReportsSuccess() throws Exception {
        boolean ok = publisher.publish(AnomalyEventType.ANOMALY_DETECTED, Map.of("anomaly_count", 2), "org-1", null);

        assertThat(ok).isTrue();
        ArgumentCaptor<AnomalyEvent> event = ArgumentCaptor.forClass(AnomalyEvent.class);
        verify(eventRepository).append(event.capture());
        assertThat(event.getValue().getType()).isEqualTo(AnomalyEventType.ANOMALY_DETECTED);
        assertThat(event.getValue().getOrganizationId()).isEqualTo("org-1");
        assertThat(event.getValue().getUserId()).isNull();
        assertThat(event.getValue().getEventId()).isNotBlank();
        assertThat(event.getValue().getTimestamp()).isNotBlank();
        assertThat(event.getValue().getData()).containsEntry("anomaly_count", 2);
        verify(metricsConfig).recordEventPublished("anomaly_detected", "success");
    }

    @Test
    void publish_sinkFailureIsSwallowed() throws Exception {
        doThrow(new RuntimeException("sink down")).when(eventRepository).append(any());

        boolean ok = publisher.publish(AnomalyEventType.ANOMALY_RESOLVED, Map.of(), "org-1", "user-1");

        assertThat(ok).isFalse();
        verify(metricsConfig).recordEventPublished("anomaly_resolved", "error");
    }
}
