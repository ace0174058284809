package com.metricwatch.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeDedupJobs;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeDedupJobs = registry.gauge("detection.jobs.active", new AtomicInteger(0));
    }

    public void recordRun(String trigger, String status, long executionTimeMs) {
        Counter.builder("detection.run.count")
                .tag("trigger", trigger)
                .tag("status", status)
                .register(registry)
                .increment();

        Timer.builder("detection.run.duration")
                .tag("trigger", trigger)
                .register(registry)
                .record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordConfigProcessed(String method, String outcome) {
        Counter.builder("detection.config.count")
                .tag("method", method)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String method, String severity) {
        Counter.builder("detection.anomaly.count")
                .tag("method", method)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordEventPublished(String eventType, String status) {
        Counter.builder("detection.event.count")
                .tag("type", eventType)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordDuplicateJobPrevented(String jobType) {
        Counter.builder("detection.jobs.duplicate.count")
                .tag("job_type", jobType)
                .register(registry)
                .increment();
    }

    public void updateActiveJobCount(int count) {
        activeDedupJobs.set(count);
    }
}
