package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.model.AnomalyEventType;
import com.metricwatch.anomaly.model.AnomalyRecord;
import com.metricwatch.anomaly.model.AnomalyStatus;
import com.metricwatch.anomaly.model.Severity;
import com.metricwatch.anomaly.repository.AnomalyRecordRepository;
import com.metricwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyResultServiceTest {

    @Mock private AnomalyRecordRepository anomalyRecordRepository;
    @Mock private AnomalyEventPublisher eventPublisher;

    private AnomalyResultService service;

    @BeforeEach
    void setUp() {
        service = new AnomalyResultService(anomalyRecordRepository, eventPublisher);
    }

    @Test
    void getAnomalies_delegatesWithLookbackWindow() {
        List<AnomalyRecord> expected = List.of(TestDataFactory.createAnomalyRecord("a1", Severity.HIGH, AnomalyStatus.OPEN));
        when(anomalyRecordRepository.findByConnection(eq("org-1"), eq("conn-1"), isNull(), eq(AnomalyStatus.OPEN),
                anyLong(), eq(100))).thenReturn(expected);

        long before = System.currentTimeMillis();
        assertThat(service.getAnomalies("org-1", "conn-1", null, AnomalyStatus.OPEN, 30, 100)).isEqualTo(expected);

        verify(anomalyRecordRepository).findByConnection(eq("org-1"), eq("conn-1"), isNull(), eq(AnomalyStatus.OPEN),
                longThat(since -> since <= before - 30L * 24 * 3600 * 1000 + 1000
                        && since >= before - 30L * 24 * 3600 * 1000 - 60_000), eq(100));
    }

    @Test
    void getAnomaly_otherOrganization_isHidden() {
        when(anomalyRecordRepository.findById("a1"))
                .thenReturn(TestDataFactory.createAnomalyRecord("a1", Severity.LOW, AnomalyStatus.OPEN));

        assertThat(service.getAnomaly("org-1", "a1")).isNotNull();
        assertThat(service.getAnomaly("org-2", "a1")).isNull();
    }

    @Test
    void updateStatus_resolvedStampsResolutionAndPublishesResolved() {
        when(anomalyRecordRepository.findById("a1"))
                .thenReturn(TestDataFactory.createAnomalyRecord("a1", Severity.HIGH, AnomalyStatus.OPEN));

        AnomalyRecord updated = service.updateStatus("org-1", "user-1", "a1", "resolved", "fixed upstream");

        assertThat(updated.getStatus()).isEqualTo(AnomalyStatus.RESOLVED);
        assertThat(updated.getResolvedBy()).isEqualTo("user-1");
        assertThat(updated.getResolvedAt()).isPositive();
        verify(anomalyRecordRepository).updateStatus(eq("a1"), eq(AnomalyStatus.RESOLVED), eq("fixed upstream"),
                longThat(t -> t > 0), eq("user-1"));
        verify(eventPublisher).publish(eq(AnomalyEventType.ANOMALY_RESOLVED), anyMap(), eq("org-1"), eq("user-1"));
    }

    @Test
    void updateStatus_acknowledgedPublishesAcknowledged() {
        when(anomalyRecordRepository.findById("a1"))
                .thenReturn(TestDataFactory.createAnomalyRecord("a1", Severity.HIGH, AnomalyStatus.OPEN));

        AnomalyRecord updated = service.updateStatus("org-1", "user-1", "a1", "acknowledged", null);

        assertThat(updated.getResolvedAt()).isZero();
        assertThat(updated.getResolvedBy()).isNull();
        verify(anomalyRecordRepository).updateStatus("a1", AnomalyStatus.ACKNOWLEDGED, null, 0L, null);
        verify(eventPublisher).publish(eq(AnomalyEventType.ANOMALY_ACKNOWLEDGED), anyMap(), eq("org-1"), eq("user-1"));
    }

    @Test
    void updateStatus_invalidStatus_throws() {
        assertThatThrownBy(() -> service.updateStatus("org-1", "user-1", "a1", "closed", null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(anomalyRecordRepository, eventPublisher);
    }

    @Test
    void updateStatus_missingAnomaly_returnsNull() {
        assertThat(service.updateStatus("org-1", "user-1", "nope", "expected", null)).isNull();
        verify(anomalyRecordRepository, never()).updateStatus(any(), any(), any(), anyLong(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void getSummary_countsBySeverityStatusAndTable() {
        AnomalyRecord other = TestDataFactory.createAnomalyRecord("a3", Severity.LOW, AnomalyStatus.RESOLVED);
        other.setTableName("customers");
        when(anomalyRecordRepository.findByConnection(eq("org-1"), eq("conn-1"), isNull(), isNull(), anyLong(), anyInt()))
                .thenReturn(List.of(
                        TestDataFactory.createAnomalyRecord("a1", Severity.HIGH, AnomalyStatus.OPEN),
                        TestDataFactory.createAnomalyRecord("a2", Severity.HIGH, AnomalyStatus.OPEN),
                        other));

        Map<String, Object> summary = service.getSummary("org-1", "conn-1", 7);

        assertThat(summary).containsEntry("total", 3).containsEntry("days", 7);
        assertThat((Map<String, Integer>) summary.get("bySeverity"))
                .containsEntry("high", 2).containsEntry("medium", 0).containsEntry("low", 1);
        assertThat((Map<String, Integer>) summary.get("byStatus"))
                .containsEntry("open", 2).containsEntry("resolved", 1).containsEntry("acknowledged", 0);
        assertThat((Map<String, Integer>) summary.get("byTable"))
                .containsEntry("orders", 2).containsEntry("customers", 1);
    }
}
