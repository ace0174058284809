package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.config.DetectionProperties;
import com.metricwatch.anomaly.model.DetectionConfig;
import com.metricwatch.anomaly.model.JobTriggerResult;
import com.metricwatch.anomaly.model.TriggerType;
import com.metricwatch.anomaly.repository.ConnectionRepository;
import com.metricwatch.anomaly.repository.DetectionConfigRepository;
import com.metricwatch.anomaly.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SchedulerServiceTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    @Mock private ConnectionRepository connectionRepository;
    @Mock private DetectionConfigRepository configRepository;
    @Mock private DetectionJobService jobService;

    private MutableClock clock;
    private DetectionProperties properties;
    private SchedulerService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        properties = new DetectionProperties();
        service = new SchedulerService(connectionRepository, configRepository, jobService, properties, clock);
    }

    @AfterEach
    void tearDown() {
        service.stop();
    }

    private static JobTriggerResult accepted() {
        return JobTriggerResult.builder().accepted(true).build();
    }

    private static DetectionConfig config(String org, String conn) {
        return DetectionConfig.builder().organizationId(org).connectionId(conn).active(true).build();
    }

    @Test
    void scheduleSweeps_plansNextDailyAndHourlyRuns() {
        service.scheduleSweeps();

        assertThat(service.getNextRuns())
                .containsEntry(SchedulerService.DAILY, Instant.parse("2024-05-02T00:00:00Z"))
                .containsEntry(SchedulerService.HOURLY, Instant.parse("2024-05-01T11:00:00Z"));
    }

    @Test
    void runPending_runsOnlyDueSweepsAndAdvancesThem() {
        when(configRepository.findActiveUpdatedSince(anyLong())).thenReturn(List.of());
        service.scheduleSweeps();

        service.runPending();
        verifyNoInteractions(configRepository, connectionRepository);

        clock.advance(Duration.ofMinutes(61));
        service.runPending();

        verify(configRepository).findActiveUpdatedSince(anyLong());
        verifyNoInteractions(connectionRepository);
        assertThat(service.getNextRuns().get(SchedulerService.HOURLY))
                .isEqualTo(Instant.parse("2024-05-01T12:01:00Z"));
    }

    @Test
    void runPending_dailySweepAtConfiguredTime() {
        when(configRepository.findActiveUpdatedSince(anyLong())).thenReturn(List.of());
        when(connectionRepository.findOrganizationIds()).thenReturn(List.of());
        service.scheduleSweeps();

        clock.set(Instant.parse("2024-05-02T00:00:30Z"));
        service.runPending();

        verify(connectionRepository).findOrganizationIds();
        assertThat(service.getNextRuns().get(SchedulerService.DAILY))
                .isEqualTo(Instant.parse("2024-05-03T00:00:00Z"));
    }

    @Test
    void dailySweep_continuesPastFailingOrganizationAndConnection() {
        when(connectionRepository.findOrganizationIds()).thenReturn(List.of("org-1", "org-2", "org-3"));
        when(connectionRepository.findConnectionIds("org-1")).thenReturn(List.of("c1", "c2"));
        when(connectionRepository.findConnectionIds("org-2")).thenThrow(new RuntimeException("scan failed"));
        when(connectionRepository.findConnectionIds("org-3")).thenReturn(List.of("c3"));
        when(jobService.trigger("org-1", "c1", TriggerType.SCHEDULED)).thenThrow(new RuntimeException("boom"));
        when(jobService.trigger("org-1", "c2", TriggerType.SCHEDULED)).thenReturn(accepted());
        when(jobService.trigger("org-3", "c3", TriggerType.SCHEDULED)).thenReturn(accepted());

        service.runDailyDetection();

        verify(jobService).trigger("org-1", "c2", TriggerType.SCHEDULED);
        verify(jobService).trigger("org-3", "c3", TriggerType.SCHEDULED);
        verify(jobService, never()).trigger(eq("org-2"), anyString(), any());
    }

    @Test
    void hourlySweep_triggersEachRecentlyUpdatedConnectionOnce() {
        when(configRepository.findActiveUpdatedSince(START.toEpochMilli() - Duration.ofHours(24).toMillis()))
                .thenReturn(List.of(
                        config("org-1", "c1"),
                        config("org-1", "c1"),
                        config("org-1", "c2"),
                        config("org-2", "c3"),
                        config("org-2", null)));
        when(jobService.trigger(anyString(), anyString(), eq(TriggerType.SCHEDULED))).thenReturn(accepted());

        service.runHourlyDetection();

        verify(jobService).trigger("org-1", "c1", TriggerType.SCHEDULED);
        verify(jobService).trigger("org-1", "c2", TriggerType.SCHEDULED);
        verify(jobService).trigger("org-2", "c3", TriggerType.SCHEDULED);
        verifyNoMoreInteractions(jobService);
    }

    @Test
    void hourlySweep_storeFailureIsContained() {
        when(configRepository.findActiveUpdatedSince(anyLong())).thenThrow(new RuntimeException("down"));

        service.runHourlyDetection();

        verifyNoInteractions(jobService);
    }

    @Test
    void startAndStop_controlDriverThread() {
        properties.getService().setTickMillis(60_000);

        service.start();
        assertThat(service.isRunning()).isTrue();

        service.stop();
        assertThat(service.isRunning()).isFalse();
    }
}
