package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.model.AutomationJob;
import com.metricwatch.anomaly.model.JobStatus;
import com.metricwatch.anomaly.model.JobTriggerResult;
import com.metricwatch.anomaly.model.RunSummary;
import com.metricwatch.anomaly.model.TriggerType;
import com.metricwatch.anomaly.repository.JobStatusRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Entry point for every detection run, manual or swept. Wraps the run in an
 * automation job and refuses to start it while an identical job is active.
 */
@Service
public class DetectionJobService {

    private static final Logger log = LoggerFactory.getLogger(DetectionJobService.class);

    public static final String JOB_TYPE = "anomaly_detection";

    private final JobDeduplicationService deduplicationService;
    private final JobStatusRepository jobStatusRepository;
    private final DetectionScheduler detectionScheduler;

    public DetectionJobService(JobDeduplicationService deduplicationService,
                               JobStatusRepository jobStatusRepository,
                               DetectionScheduler detectionScheduler) {
        this.deduplicationService = deduplicationService;
        this.jobStatusRepository = jobStatusRepository;
        this.detectionScheduler = detectionScheduler;
    }

    public JobTriggerResult trigger(String organizationId, String connectionId, TriggerType triggerType) {
        String fingerprint = deduplicationService.fingerprint(connectionId, JOB_TYPE, triggerType.getCode(),
                Map.of("organization_id", organizationId));

        if (deduplicationService.isDuplicate(fingerprint)) {
            log.info("Skipping duplicate detection job for connection {} ({})", connectionId, triggerType.getCode());
            return duplicate(null);
        }

        long now = System.currentTimeMillis();
        AutomationJob job = AutomationJob.builder()
                .jobId(UUID.randomUUID().toString())
                .organizationId(organizationId)
                .connectionId(connectionId)
                .jobType(JOB_TYPE)
                .trigger(triggerType.getCode())
                .status(JobStatus.SCHEDULED)
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobStatusRepository.save(job);

        if (!deduplicationService.register(fingerprint, job.getJobId(), connectionId, JOB_TYPE, triggerType.getCode())) {
            jobStatusRepository.updateStatus(job.getJobId(), JobStatus.CANCELLED);
            return duplicate(job.getJobId());
        }

        JobStatus finalStatus = JobStatus.FAILED;
        try {
            jobStatusRepository.updateStatus(job.getJobId(), JobStatus.RUNNING);
            RunSummary summary = detectionScheduler.scheduleDetectionRun(organizationId, connectionId, triggerType);
            finalStatus = summary.isSuccess() ? JobStatus.COMPLETED : JobStatus.FAILED;
            return JobTriggerResult.builder()
                    .accepted(true)
                    .jobId(job.getJobId())
                    .message(summary.getMessage())
                    .summary(summary)
                    .build();
        } finally {
            updateStatusQuietly(job.getJobId(), finalStatus);
            deduplicationService.markCompleted(fingerprint, finalStatus);
        }
    }

    public Map<String, Object> getActiveJobsSummary() {
        return deduplicationService.getActiveJobsSummary();
    }

    private void updateStatusQuietly(String jobId, JobStatus status) {
        try {
            jobStatusRepository.updateStatus(jobId, status);
        } catch (Exception e) {
            log.error("Failed to update job {} to {}: {}", jobId, status.getCode(), e.getMessage());
        }
    }

    private static JobTriggerResult duplicate(String jobId) {
        return JobTriggerResult.builder()
                .accepted(false)
                .reason(JobTriggerResult.REASON_DUPLICATE)
                .message("A detection job for this connection is already running")
                .jobId(jobId)
                .build();
    }
}
