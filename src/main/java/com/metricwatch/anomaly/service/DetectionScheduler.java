package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.config.DetectionProperties;
import com.metricwatch.anomaly.config.MetricsConfig;
import com.metricwatch.anomaly.engine.AnomalyDetector;
import com.metricwatch.anomaly.model.AnomalyEventType;
import com.metricwatch.anomaly.model.AnomalyRecord;
import com.metricwatch.anomaly.model.AnomalyResult;
import com.metricwatch.anomaly.model.DetectionConfig;
import com.metricwatch.anomaly.model.DetectionRun;
import com.metricwatch.anomaly.model.MetricPoint;
import com.metricwatch.anomaly.model.RunStatus;
import com.metricwatch.anomaly.model.RunSummary;
import com.metricwatch.anomaly.model.Severity;
import com.metricwatch.anomaly.model.TriggerType;
import com.metricwatch.anomaly.repository.AnomalyRecordRepository;
import com.metricwatch.anomaly.repository.DetectionConfigRepository;
import com.metricwatch.anomaly.repository.DetectionRunRepository;
import com.metricwatch.anomaly.repository.MetricHistoryRepository;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Executes one detection run: every active configuration in scope is processed
 * as an independent task on a bounded worker pool, and the run record moves from
 * RUNNING to exactly one terminal state.
 *
 * A failing configuration never fails the run. Each task has its own timeout,
 * counted from the moment a worker picks it up; a timed-out task is reported as
 * failed for that configuration and the run continues without it.
 */
@Service
public class DetectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(DetectionScheduler.class);

    private final AnomalyDetector detector;
    private final DetectionConfigRepository configRepository;
    private final MetricHistoryRepository metricHistoryRepository;
    private final AnomalyRecordRepository anomalyRecordRepository;
    private final DetectionRunRepository runRepository;
    private final AnomalyEventPublisher eventPublisher;
    private final DetectionProperties.Scheduler settings;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    private final ExecutorService workerPool;
    private final ScheduledExecutorService watchdog;

    public DetectionScheduler(AnomalyDetector detector,
                              DetectionConfigRepository configRepository,
                              MetricHistoryRepository metricHistoryRepository,
                              AnomalyRecordRepository anomalyRecordRepository,
                              DetectionRunRepository runRepository,
                              AnomalyEventPublisher eventPublisher,
                              DetectionProperties properties,
                              MetricsConfig metricsConfig,
                              Tracer tracer) {
        this.detector = detector;
        this.configRepository = configRepository;
        this.metricHistoryRepository = metricHistoryRepository;
        this.anomalyRecordRepository = anomalyRecordRepository;
        this.runRepository = runRepository;
        this.eventPublisher = eventPublisher;
        this.settings = properties.getScheduler();
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;

        AtomicInteger workerCount = new AtomicInteger();
        this.workerPool = Executors.newFixedThreadPool(Math.max(1, settings.getMaxWorkers()), r -> {
            Thread t = new Thread(r, "detection-worker-" + workerCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "detection-watchdog");
            t.setDaemon(true);
            return t;
        });
        log.info("Detection scheduler initialized with {} workers, task timeout {}s",
                settings.getMaxWorkers(), settings.getTaskTimeoutSeconds());
    }

    /**
     * Run detection for every active configuration of an organization, optionally
     * narrowed to one connection. Blocks until every task has finished or timed out.
     */
    @Observed(name = "detection.run", contextualName = "schedule-detection-run")
    public RunSummary scheduleDetectionRun(String organizationId, String connectionId, TriggerType triggerType) {
        String runId = null;
        try {
            DetectionRun run = runRepository.create(organizationId, connectionId, triggerType);
            runId = run.getRunId();
            log.info("Started detection run {} for organization {} (trigger: {})",
                    runId, organizationId, triggerType.getCode());

            List<DetectionConfig> configs = configRepository.findActive(organizationId, connectionId);
            if (configs.isEmpty()) {
                runRepository.complete(runId, RunStatus.COMPLETED, 0, 0, null);
                metricsConfig.recordRun(triggerType.getCode(), RunStatus.COMPLETED.getCode(), 0);
                log.info("No active anomaly detection configs for organization {}", organizationId);
                return RunSummary.builder()
                        .status(RunSummary.SUCCESS)
                        .runId(runId)
                        .message("No active configurations found")
                        .build();
            }

            long start = System.currentTimeMillis();
            List<CompletableFuture<ConfigOutcome>> futures = new ArrayList<>();
            for (DetectionConfig config : configs) {
                futures.add(submit(config, runId));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            int processed = 0;
            int detected = 0;
            for (CompletableFuture<ConfigOutcome> future : futures) {
                ConfigOutcome outcome = future.join();
                processed += outcome.getProcessed();
                detected += outcome.getDetected();
            }

            runRepository.complete(runId, RunStatus.COMPLETED, processed, detected, null);
            metricsConfig.recordRun(triggerType.getCode(), RunStatus.COMPLETED.getCode(),
                    System.currentTimeMillis() - start);
            log.info("Completed detection run {}: processed {} configs, detected {} anomalies",
                    runId, processed, detected);

            return RunSummary.builder()
                    .status(RunSummary.SUCCESS)
                    .runId(runId)
                    .metricsProcessed(processed)
                    .anomaliesDetected(detected)
                    .build();

        } catch (Exception e) {
            log.error("Error in detection run for organization {}: {}", organizationId, e.getMessage(), e);
            if (runId != null) {
                markFailed(runId, e.getMessage());
            }
            metricsConfig.recordRun(triggerType.getCode(), RunStatus.FAILED.getCode(), 0);
            return RunSummary.builder()
                    .status(RunSummary.ERROR)
                    .runId(runId)
                    .message(e.getMessage())
                    .build();
        }
    }

    /**
     * Process one configuration: fetch its history, detect, persist the anomalies
     * in batches and emit one aggregated event. Never throws.
     */
    ConfigOutcome processConfig(DetectionConfig rawConfig, String runId) {
        return processConfig(rawConfig, runId, () -> false);
    }

    /**
     * @param abandoned true once the run has stopped waiting for this config; nothing
     *                  is persisted or published after that point
     */
    ConfigOutcome processConfig(DetectionConfig rawConfig, String runId, BooleanSupplier abandoned) {
        Span span = tracer.nextSpan()
                .name("detection.config")
                .tag("config.id", String.valueOf(rawConfig.getId()))
                .tag("config.metric", String.valueOf(rawConfig.getMetricName()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            DetectionConfig config = detector.validateConfig(rawConfig);

            int days = Math.max(config.getBaselineWindowDays(), settings.getMinHistoryDays());
            List<MetricPoint> history = metricHistoryRepository.getMetricHistory(
                    config.getOrganizationId(), config.getConnectionId(), config.getMetricName(),
                    config.getTableName(), config.getColumnName(), days, settings.getHistoryFetchLimit());

            if (history.size() < config.getMinDataPoints()) {
                log.info("Insufficient data for config {}: {} points, need {}",
                        config.getId(), history.size(), config.getMinDataPoints());
                metricsConfig.recordConfigProcessed(config.getDetectionMethod(), "skipped");
                return ConfigOutcome.EMPTY;
            }

            List<AnomalyResult> anomalies = detector.detectAnomalies(config, history);
            span.tag("anomalies.count", String.valueOf(anomalies.size()));

            if (abandoned.getAsBoolean()) {
                log.warn("Config {} finished after its run gave up on it; discarding {} anomalies",
                        config.getId(), anomalies.size());
                return ConfigOutcome.EMPTY;
            }

            if (!anomalies.isEmpty()) {
                saveInBatches(config, runId, anomalies);
                publishDetected(config, anomalies);
                log.info("Detected {} anomalies for {}.{}.{}", anomalies.size(),
                        config.getTableName(), config.getColumnName(), config.getMetricName());
            }

            metricsConfig.recordConfigProcessed(config.getDetectionMethod(), "processed");
            return new ConfigOutcome(1, anomalies.size());

        } catch (Exception e) {
            span.error(e);
            metricsConfig.recordConfigProcessed(String.valueOf(rawConfig.getDetectionMethod()), "error");
            log.error("Error processing config {}: {}", rawConfig.getId(), e.getMessage(), e);
            return ConfigOutcome.EMPTY;
        } finally {
            span.end();
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down detection scheduler");
        workerPool.shutdown();
        watchdog.shutdownNow();
        try {
            if (!workerPool.awaitTermination(10, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private CompletableFuture<ConfigOutcome> submit(DetectionConfig config, String runId) {
        CompletableFuture<ConfigOutcome> future = new CompletableFuture<>();
        long timeoutSeconds = settings.getTaskTimeoutSeconds();

        try {
            workerPool.execute(() -> {
                ScheduledFuture<?> timer = null;
                if (timeoutSeconds > 0) {
                    timer = watchdog.schedule(() -> {
                        if (future.complete(ConfigOutcome.EMPTY)) {
                            metricsConfig.recordConfigProcessed(
                                    String.valueOf(config.getDetectionMethod()), "timeout");
                            log.error("Config {} timed out after {}s", config.getId(), timeoutSeconds);
                        }
                    }, timeoutSeconds, TimeUnit.SECONDS);
                }
                try {
                    future.complete(processConfig(config, runId, future::isDone));
                } finally {
                    if (timer != null) {
                        timer.cancel(false);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected config {}: {}", config.getId(), e.getMessage());
            future.complete(ConfigOutcome.EMPTY);
        }
        return future;
    }

    private void saveInBatches(DetectionConfig config, String runId, List<AnomalyResult> anomalies) {
        long now = System.currentTimeMillis();
        List<AnomalyRecord> records = new ArrayList<>(anomalies.size());
        for (AnomalyResult anomaly : anomalies) {
            records.add(AnomalyRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .organizationId(config.getOrganizationId())
                    .connectionId(config.getConnectionId())
                    .configId(config.getId())
                    .runId(runId)
                    .tableName(config.getTableName())
                    .columnName(config.getColumnName())
                    .metricName(config.getMetricName())
                    .metricValue(anomaly.getValue())
                    .metricTimestamp(anomaly.getTimestamp())
                    .method(anomaly.getMethod())
                    .severity(anomaly.getSeverity())
                    .score(anomaly.getScore())
                    .threshold(anomaly.getThreshold())
                    .detectedAt(now)
                    .build());
        }

        int batchSize = Math.max(1, settings.getResultBatchSize());
        for (int i = 0; i < records.size(); i += batchSize) {
            List<AnomalyRecord> batch = records.subList(i, Math.min(i + batchSize, records.size()));
            try {
                anomalyRecordRepository.saveBatch(batch);
                batch.forEach(r -> metricsConfig.recordAnomaly(r.getMethod(), r.getSeverity().getCode()));
            } catch (Exception e) {
                log.error("Error storing anomaly batch {} for config {}: {}",
                        i / batchSize + 1, config.getId(), e.getMessage());
            }
        }
    }

    private void publishDetected(DetectionConfig config, List<AnomalyResult> anomalies) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("config_id", config.getId());
        data.put("connection_id", config.getConnectionId());
        data.put("table_name", config.getTableName());
        data.put("column_name", config.getColumnName());
        data.put("metric_name", config.getMetricName());
        data.put("anomaly_count", anomalies.size());
        data.put("detection_method", config.getDetectionMethod());
        data.put("high_severity_count", countSeverity(anomalies, Severity.HIGH));
        data.put("medium_severity_count", countSeverity(anomalies, Severity.MEDIUM));
        data.put("low_severity_count", countSeverity(anomalies, Severity.LOW));

        eventPublisher.publish(AnomalyEventType.ANOMALY_DETECTED, data, config.getOrganizationId(), null);
    }

    private static long countSeverity(List<AnomalyResult> anomalies, Severity severity) {
        return anomalies.stream().filter(a -> a.getSeverity() == severity).count();
    }

    private void markFailed(String runId, String error) {
        try {
            runRepository.complete(runId, RunStatus.FAILED, 0, 0, error);
        } catch (Exception e) {
            log.error("Could not mark run {} as failed: {}", runId, e.getMessage());
        }
    }

    static final class ConfigOutcome {

        static final ConfigOutcome EMPTY = new ConfigOutcome(0, 0);

        private final int processed;
        private final int detected;

        ConfigOutcome(int processed, int detected) {
            this.processed = processed;
            this.detected = detected;
        }

        int getProcessed() {
            return processed;
        }

        int getDetected() {
            return detected;
        }
    }
}
