package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.config.DetectionProperties;
import com.metricwatch.anomaly.model.DetectionConfig;
import com.metricwatch.anomaly.model.JobTriggerResult;
import com.metricwatch.anomaly.model.TriggerType;
import com.metricwatch.anomaly.repository.ConnectionRepository;
import com.metricwatch.anomaly.repository.DetectionConfigRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drives the periodic detection sweeps from a single background thread.
 *
 * <ul>
 *   <li>Daily: every connection of every organization.</li>
 *   <li>Hourly: only connections with configurations updated recently.</li>
 * </ul>
 *
 * Sweeps are executed inline on the driver thread, so they never overlap each other.
 */
@Service
public class SchedulerService {

    private static final Logger log = LoggerFactory.getLogger(SchedulerService.class);

    static final String DAILY = "daily";
    static final String HOURLY = "hourly";

    private final ConnectionRepository connectionRepository;
    private final DetectionConfigRepository configRepository;
    private final DetectionJobService jobService;
    private final DetectionProperties.Service settings;
    private final Clock clock;

    private final Map<String, Instant> nextRuns = new LinkedHashMap<>();
    private volatile boolean running;
    private Thread driver;

    @Autowired
    public SchedulerService(ConnectionRepository connectionRepository,
                            DetectionConfigRepository configRepository,
                            DetectionJobService jobService,
                            DetectionProperties properties) {
        this(connectionRepository, configRepository, jobService, properties, Clock.systemDefaultZone());
    }

    SchedulerService(ConnectionRepository connectionRepository,
                     DetectionConfigRepository configRepository,
                     DetectionJobService jobService,
                     DetectionProperties properties,
                     Clock clock) {
        this.connectionRepository = connectionRepository;
        this.configRepository = configRepository;
        this.jobService = jobService;
        this.settings = properties.getService();
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (settings.isEnabled()) {
            start();
        } else {
            log.info("Anomaly detection scheduler disabled");
        }
    }

    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        scheduleSweeps();

        running = true;
        driver = new Thread(this::runLoop, "detection-scheduler");
        driver.setDaemon(true);
        driver.start();
        log.info("Anomaly detection scheduler started (daily at {}, hourly every {} min)",
                settings.getDailyTime(), settings.getHourlyIntervalMinutes());
    }

    @PreDestroy
    public synchronized void stop() {
        running = false;
        if (driver != null) {
            driver.interrupt();
            driver = null;
        }
        log.info("Anomaly detection scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public Map<String, Instant> getNextRuns() {
        synchronized (nextRuns) {
            return new LinkedHashMap<>(nextRuns);
        }
    }

    void scheduleSweeps() {
        Instant now = clock.instant();
        synchronized (nextRuns) {
            nextRuns.put(DAILY, nextDailyRun(now));
            nextRuns.put(HOURLY, now.plus(Duration.ofMinutes(settings.getHourlyIntervalMinutes())));
        }
    }

    /**
     * Execute every sweep whose next run time has passed. The next run time is
     * advanced before the sweep executes, so a failing sweep is not retried
     * until its following slot.
     */
    void runPending() {
        Instant now = clock.instant();
        List<String> due = new ArrayList<>();
        synchronized (nextRuns) {
            for (Map.Entry<String, Instant> entry : nextRuns.entrySet()) {
                if (!now.isBefore(entry.getValue())) {
                    due.add(entry.getKey());
                }
            }
            for (String name : due) {
                nextRuns.put(name, DAILY.equals(name)
                        ? nextDailyRun(now)
                        : now.plus(Duration.ofMinutes(settings.getHourlyIntervalMinutes())));
            }
        }

        for (String name : due) {
            if (DAILY.equals(name)) {
                runDailyDetection();
            } else {
                runHourlyDetection();
            }
        }
    }

    public void runDailyDetection() {
        log.info("Starting daily anomaly detection run");
        int triggered = 0;
        try {
            for (String organizationId : connectionRepository.findOrganizationIds()) {
                try {
                    for (String connectionId : connectionRepository.findConnectionIds(organizationId)) {
                        if (triggerQuietly(organizationId, connectionId)) {
                            triggered++;
                        }
                    }
                } catch (Exception e) {
                    log.error("Error processing organization {}: {}", organizationId, e.getMessage(), e);
                }
            }
        } catch (Exception e) {
            log.error("Error in daily anomaly detection: {}", e.getMessage(), e);
        }
        log.info("Daily anomaly detection run finished: {} jobs triggered", triggered);
    }

    public void runHourlyDetection() {
        log.info("Starting hourly anomaly detection run");
        int triggered = 0;
        try {
            long since = clock.millis() - Duration.ofHours(settings.getRecentConfigHours()).toMillis();
            Map<String, Set<String>> connectionsByOrg = new LinkedHashMap<>();
            for (DetectionConfig config : configRepository.findActiveUpdatedSince(since)) {
                if (config.getOrganizationId() == null || config.getConnectionId() == null) continue;
                connectionsByOrg.computeIfAbsent(config.getOrganizationId(), k -> new LinkedHashSet<>())
                        .add(config.getConnectionId());
            }

            for (Map.Entry<String, Set<String>> entry : connectionsByOrg.entrySet()) {
                for (String connectionId : entry.getValue()) {
                    if (triggerQuietly(entry.getKey(), connectionId)) {
                        triggered++;
                    }
                }
            }
        } catch (Exception e) {
            log.error("Error in hourly anomaly detection: {}", e.getMessage(), e);
        }
        log.info("Hourly anomaly detection run finished: {} jobs triggered", triggered);
    }

    private boolean triggerQuietly(String organizationId, String connectionId) {
        try {
            JobTriggerResult result = jobService.trigger(organizationId, connectionId, TriggerType.SCHEDULED);
            if (!result.isAccepted()) {
                log.info("Detection for connection {} skipped: {}", connectionId, result.getReason());
            }
            return result.isAccepted();
        } catch (Exception e) {
            log.error("Error running detection for connection {}: {}", connectionId, e.getMessage(), e);
            return false;
        }
    }

    private void runLoop() {
        while (running) {
            try {
                runPending();
                Thread.sleep(settings.getTickMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Error in scheduler loop: {}", e.getMessage(), e);
                try {
                    Thread.sleep(settings.getErrorBackoffMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    private Instant nextDailyRun(Instant now) {
        LocalTime at = LocalTime.parse(settings.getDailyTime());
        ZonedDateTime current = now.atZone(clock.getZone());
        ZonedDateTime candidate = current.with(at).withSecond(0).withNano(0);
        if (!candidate.isAfter(current)) {
            candidate = candidate.plusDays(1);
        }
        return candidate.toInstant();
    }
}
