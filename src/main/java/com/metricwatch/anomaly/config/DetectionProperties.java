package com.metricwatch.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionProperties {

    private Scheduler scheduler = new Scheduler();

    private Service service = new Service();

    private Dedup dedup = new Dedup();

    @Data
    public static class Scheduler {
        // Worker pool size shared by all runs of this process
        private int maxWorkers = 5;
        // Per-config budget, measured from the moment the task starts. 0 disables it.
        private long taskTimeoutSeconds = 300;
        // History fetch never looks back less than this, whatever baselineWindowDays says
        private int minHistoryDays = 30;
        private int historyFetchLimit = 1000;
        private int resultBatchSize = 50;
    }

    @Data
    public static class Service {
        private boolean enabled = true;
        // Local time of the daily full sweep, HH:mm
        private String dailyTime = "00:00";
        private long tickMillis = 1000;
        private long errorBackoffMillis = 5000;
        private long hourlyIntervalMinutes = 60;
        // Hourly sweep only covers configs updated within this many hours
        private long recentConfigHours = 24;
    }

    @Data
    public static class Dedup {
        private int maxAgeMinutes = 30;
        private int sweepIntervalMinutes = 5;
    }
}
