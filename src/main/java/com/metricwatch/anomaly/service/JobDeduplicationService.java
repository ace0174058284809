package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.config.DetectionProperties;
import com.metricwatch.anomaly.config.MetricsConfig;
import com.metricwatch.anomaly.model.JobStatus;
import com.metricwatch.anomaly.repository.JobStatusRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * In-process guard against two concurrent jobs with the same identity.
 *
 * A job's identity is its fingerprint: connection, job type, trigger and any
 * extra parameters. A registered fingerprint counts as a duplicate only while it
 * is younger than the max age and the job store still reports the job as
 * scheduled or running. When the job store cannot be reached the job is assumed
 * to be still active.
 *
 * Every read-modify-write of the tracking map happens under one lock, so
 * check-then-register is atomic. This is not a distributed lock: it only covers
 * jobs started by this process.
 */
@Service
public class JobDeduplicationService {

    private static final Logger log = LoggerFactory.getLogger(JobDeduplicationService.class);

    private final JobStatusRepository jobStatusRepository;
    private final DetectionProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, TrackedJob> activeJobs = new HashMap<>();

    @Autowired
    public JobDeduplicationService(JobStatusRepository jobStatusRepository,
                                   DetectionProperties properties,
                                   MetricsConfig metricsConfig) {
        this(jobStatusRepository, properties, metricsConfig, Clock.systemUTC());
    }

    JobDeduplicationService(JobStatusRepository jobStatusRepository,
                            DetectionProperties properties,
                            MetricsConfig metricsConfig,
                            Clock clock) {
        this.jobStatusRepository = jobStatusRepository;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        log.info("Job deduplication initialized (max age {} min)", properties.getDedup().getMaxAgeMinutes());
    }

    /**
     * Deterministic identity of a job. Extra parameters are appended in key order
     * as {@code :key=value}, then the whole string is MD5-hashed.
     */
    public String fingerprint(String connectionId, String jobType, String trigger, Map<String, ?> extra) {
        StringBuilder data = new StringBuilder()
                .append(connectionId).append(':')
                .append(jobType).append(':')
                .append(trigger != null ? trigger : "unknown");

        if (extra != null) {
            for (Map.Entry<String, ?> entry : new TreeMap<>(extra).entrySet()) {
                data.append(':').append(entry.getKey()).append('=').append(entry.getValue());
            }
        }

        return DigestUtils.md5DigestAsHex(data.toString().getBytes(StandardCharsets.UTF_8));
    }

    public boolean isDuplicate(String fingerprint) {
        return isDuplicate(fingerprint, properties.getDedup().getMaxAgeMinutes());
    }

    /**
     * Whether a job with this fingerprint is still active. Expired or finished
     * entries are evicted as part of the check.
     */
    public boolean isDuplicate(String fingerprint, int maxAgeMinutes) {
        synchronized (lock) {
            return checkDuplicate(fingerprint, maxAgeMinutes);
        }
    }

    /**
     * Start tracking a job.
     *
     * @return false, without registering, if an active job already holds the fingerprint
     */
    public boolean register(String fingerprint, String jobId, String connectionId,
                            String jobType, String trigger) {
        synchronized (lock) {
            if (checkDuplicate(fingerprint, properties.getDedup().getMaxAgeMinutes())) {
                metricsConfig.recordDuplicateJobPrevented(jobType);
                return false;
            }

            activeJobs.put(fingerprint, new TrackedJob(jobId, connectionId, jobType,
                    trigger != null ? trigger : "unknown", clock.millis()));
            metricsConfig.updateActiveJobCount(activeJobs.size());

            log.info("Registered job: {} for connection {} (fingerprint: {}...)",
                    jobType, connectionId, fingerprint.substring(0, Math.min(8, fingerprint.length())));
            return true;
        }
    }

    public void markCompleted(String fingerprint, JobStatus status) {
        synchronized (lock) {
            TrackedJob job = activeJobs.remove(fingerprint);
            if (job != null) {
                log.info("Marking job completed: {} ({})", job.jobType, status.getCode());
                metricsConfig.updateActiveJobCount(activeJobs.size());
            }
        }
    }

    /**
     * Periodic eviction of entries that are too old or whose job has finished.
     *
     * @return number of entries removed
     */
    @Scheduled(fixedRateString = "${detection.dedup.sweep-interval-minutes:5}",
               initialDelayString = "${detection.dedup.sweep-interval-minutes:5}",
               timeUnit = TimeUnit.MINUTES)
    public int cleanupStaleJobs() {
        synchronized (lock) {
            long now = clock.millis();
            long maxAgeMs = TimeUnit.MINUTES.toMillis(properties.getDedup().getMaxAgeMinutes());
            int removed = 0;

            Iterator<TrackedJob> it = activeJobs.values().iterator();
            while (it.hasNext()) {
                TrackedJob job = it.next();
                if (now - job.createdAt > maxAgeMs || !isJobStillActive(job)) {
                    it.remove();
                    removed++;
                }
            }

            if (removed > 0) {
                log.info("Cleaned up {} old job entries", removed);
                metricsConfig.updateActiveJobCount(activeJobs.size());
            }
            return removed;
        }
    }

    /**
     * Diagnostic snapshot of tracked jobs. Not a source of truth for job state.
     */
    public Map<String, Object> getActiveJobsSummary() {
        synchronized (lock) {
            long now = clock.millis();
            Map<String, Integer> byType = new TreeMap<>();
            Map<String, Integer> byConnection = new TreeMap<>();
            long oldestAgeMs = 0;

            for (TrackedJob job : activeJobs.values()) {
                byType.merge(job.jobType, 1, Integer::sum);
                byConnection.merge(job.connectionId, 1, Integer::sum);
                oldestAgeMs = Math.max(oldestAgeMs, now - job.createdAt);
            }

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("totalActive", activeJobs.size());
            summary.put("byType", byType);
            summary.put("byConnection", byConnection);
            summary.put("oldestJobAgeSeconds", oldestAgeMs / 1000.0);
            return Collections.unmodifiableMap(summary);
        }
    }

    public List<String> getTrackedJobIds() {
        synchronized (lock) {
            List<String> ids = new ArrayList<>();
            activeJobs.values().forEach(job -> ids.add(job.jobId));
            return ids;
        }
    }

    // Caller holds the lock
    private boolean checkDuplicate(String fingerprint, int maxAgeMinutes) {
        TrackedJob job = activeJobs.get(fingerprint);
        if (job == null) {
            return false;
        }

        long ageMs = clock.millis() - job.createdAt;
        if (ageMs > TimeUnit.MINUTES.toMillis(maxAgeMinutes)) {
            activeJobs.remove(fingerprint);
            metricsConfig.updateActiveJobCount(activeJobs.size());
            return false;
        }

        if (isJobStillActive(job)) {
            log.info("Duplicate job detected: {} (age: {}s)", fingerprint, String.format("%.1f", ageMs / 1000.0));
            return true;
        }

        activeJobs.remove(fingerprint);
        metricsConfig.updateActiveJobCount(activeJobs.size());
        return false;
    }

    private boolean isJobStillActive(TrackedJob job) {
        try {
            return jobStatusRepository.findStatus(job.jobId)
                    .map(JobStatus::isActive)
                    .orElse(false);
        } catch (Exception e) {
            // Fail open: an unverifiable job is treated as still running
            log.error("Error checking status of job {}: {}", job.jobId, e.getMessage());
            return true;
        }
    }

    private static final class TrackedJob {
        private final String jobId;
        private final String connectionId;
        private final String jobType;
        private final String trigger;
        private final long createdAt;

        private TrackedJob(String jobId, String connectionId, String jobType, String trigger, long createdAt) {
            this.jobId = jobId;
            this.connectionId = connectionId;
            this.jobType = jobType;
            this.trigger = trigger;
            this.createdAt = createdAt;
        }
    }
}
