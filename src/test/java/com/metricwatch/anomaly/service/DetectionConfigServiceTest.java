package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.engine.AnomalyDetector;
import com.metricwatch.anomaly.engine.algorithms.IqrAlgorithm;
import com.metricwatch.anomaly.engine.algorithms.MovingAverageAlgorithm;
import com.metricwatch.anomaly.engine.algorithms.ZScoreAlgorithm;
import com.metricwatch.anomaly.model.AnomalyEventType;
import com.metricwatch.anomaly.model.DetectionConfig;
import com.metricwatch.anomaly.repository.DetectionConfigRepository;
import com.metricwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DetectionConfigServiceTest {

    @Mock private DetectionConfigRepository configRepository;
    @Mock private AnomalyEventPublisher eventPublisher;

    private DetectionConfigService service;

    @BeforeEach
    void setUp() {
        AnomalyDetector detector = new AnomalyDetector(List.of(
                new ZScoreAlgorithm(), new IqrAlgorithm(), new MovingAverageAlgorithm()));
        service = new DetectionConfigService(configRepository, detector, eventPublisher);
    }

    @Test
    void createConfig_appliesDefaultsAndOwnership() {
        DetectionConfig request = DetectionConfig.builder()
                .connectionId("conn-1")
                .tableName("orders")
                .metricName("row_count")
                .build();

        DetectionConfig created = service.createConfig("org-1", "user-1", request);

        assertThat(created.getId()).isNotBlank();
        assertThat(created.getOrganizationId()).isEqualTo("org-1");
        assertThat(created.getCreatedBy()).isEqualTo("user-1");
        assertThat(created.getDetectionMethod()).isEqualTo("zscore");
        assertThat(created.getSensitivity()).isEqualTo(1.0);
        assertThat(created.isActive()).isTrue();
        assertThat(created.getCreatedAt()).isPositive();
        verify(configRepository).save(created);
        verify(eventPublisher).publish(eq(AnomalyEventType.ANOMALY_CONFIG_CREATED), anyMap(), eq("org-1"), eq("user-1"));
    }

    @Test
    void createConfig_unknownMethod_isRejected() {
        DetectionConfig request = DetectionConfig.builder()
                .connectionId("conn-1").metricName("row_count").detectionMethod("prophet").build();

        assertThatThrownBy(() -> service.createConfig("org-1", "user-1", request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("prophet");
        verifyNoInteractions(configRepository, eventPublisher);
    }

    @Test
    void createConfig_missingMetricName_isRejected() {
        DetectionConfig request = DetectionConfig.builder().connectionId("conn-1").build();

        assertThatThrownBy(() -> service.createConfig("org-1", "user-1", request))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createConfig_nonPositiveSensitivity_isRejected() {
        for (double sensitivity : new double[]{-1.0, 0.0, Double.NaN}) {
            DetectionConfig request = DetectionConfig.builder()
                    .connectionId("conn-1").metricName("row_count").sensitivity(sensitivity).build();

            assertThatThrownBy(() -> service.createConfig("org-1", "user-1", request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("sensitivity");
        }
        verifyNoInteractions(configRepository, eventPublisher);
    }

    @Test
    void createConfig_minDataPointsBelowOne_isRejected() {
        DetectionConfig request = DetectionConfig.builder()
                .connectionId("conn-1").metricName("row_count").minDataPoints(0).build();

        assertThatThrownBy(() -> service.createConfig("org-1", "user-1", request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minDataPoints");
        verifyNoInteractions(configRepository, eventPublisher);
    }

    @Test
    void createConfig_baselineWindowBelowOne_isRejected() {
        DetectionConfig request = DetectionConfig.builder()
                .connectionId("conn-1").metricName("row_count").baselineWindowDays(-3).build();

        assertThatThrownBy(() -> service.createConfig("org-1", "user-1", request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("baselineWindowDays");
        verifyNoInteractions(configRepository, eventPublisher);
    }

    @Test
    void updateConfig_zeroSensitivity_isRejectedAndNotSaved() {
        when(configRepository.findById("cfg-1"))
                .thenReturn(TestDataFactory.createConfig("cfg-1", "row_count", "zscore"));

        DetectionConfig patch = DetectionConfig.builder().sensitivity(0.0).build();

        assertThatThrownBy(() -> service.updateConfig("org-1", "user-1", "cfg-1", patch))
                .isInstanceOf(IllegalArgumentException.class);
        verify(configRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void updateConfig_mergesOnlyProvidedFields() {
        DetectionConfig existing = TestDataFactory.createConfig("cfg-1", "row_count", "zscore");
        when(configRepository.findById("cfg-1")).thenReturn(existing);

        DetectionConfig patch = DetectionConfig.builder().sensitivity(2.0).active(false).build();
        DetectionConfig updated = service.updateConfig("org-1", "user-1", "cfg-1", patch);

        assertThat(updated.getSensitivity()).isEqualTo(2.0);
        assertThat(updated.isActive()).isFalse();
        assertThat(updated.getDetectionMethod()).isEqualTo("zscore");
        assertThat(updated.getMetricName()).isEqualTo("row_count");
        assertThat(updated.getMinDataPoints()).isEqualTo(7);
        verify(configRepository).save(updated);
        verify(eventPublisher).publish(eq(AnomalyEventType.ANOMALY_CONFIG_UPDATED), anyMap(), eq("org-1"), eq("user-1"));
    }

    @Test
    void updateConfig_switchToMovingAverage_addsDefaultWindow() {
        when(configRepository.findById("cfg-1"))
                .thenReturn(TestDataFactory.createConfig("cfg-1", "row_count", "zscore"));

        DetectionConfig updated = service.updateConfig("org-1", "user-1", "cfg-1",
                DetectionConfig.builder().detectionMethod("moving_average").build());

        assertThat(updated.getConfigParams()).containsEntry("window", 7);
    }

    @Test
    void updateConfig_missingOrForeign_returnsNull() {
        DetectionConfig foreign = TestDataFactory.createConfig("cfg-2", "row_count", "zscore");
        foreign.setOrganizationId("org-other");
        lenient().when(configRepository.findById("cfg-2")).thenReturn(foreign);

        assertThat(service.updateConfig("org-1", "user-1", "missing", new DetectionConfig())).isNull();
        assertThat(service.updateConfig("org-1", "user-1", "cfg-2", new DetectionConfig())).isNull();
        verify(configRepository, never()).save(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void deleteConfig_publishesDeletionEvent() {
        when(configRepository.findById("cfg-1"))
                .thenReturn(TestDataFactory.createConfig("cfg-1", "row_count", "zscore"));
        when(configRepository.delete("cfg-1")).thenReturn(true);

        assertThat(service.deleteConfig("org-1", "user-1", "cfg-1")).isTrue();

        ArgumentCaptor<Map<String, Object>> data = ArgumentCaptor.forClass(Map.class);
        verify(eventPublisher).publish(eq(AnomalyEventType.ANOMALY_CONFIG_UPDATED), data.capture(),
                eq("org-1"), eq("user-1"));
        assertThat(data.getValue()).containsEntry("deleted", true).containsEntry("config_id", "cfg-1");
    }
}
