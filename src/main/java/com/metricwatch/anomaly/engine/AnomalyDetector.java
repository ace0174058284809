package com.metricwatch.anomaly.engine;

import com.metricwatch.anomaly.model.AnomalyResult;
import com.metricwatch.anomaly.model.DetectionConfig;
import com.metricwatch.anomaly.model.DetectionMethod;
import com.metricwatch.anomaly.model.MetricPoint;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a detection configuration plus a metric history into formatted anomalies.
 * Uses the Strategy pattern: each DetectionMethod is handled by a registered AnomalyAlgorithm.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    public static final String DEFAULT_METHOD = "zscore";
    public static final double DEFAULT_SENSITIVITY = 1.0;
    public static final int DEFAULT_MIN_DATA_POINTS = 7;
    public static final int DEFAULT_BASELINE_WINDOW_DAYS = 14;

    private final Map<DetectionMethod, AnomalyAlgorithm> algorithmMap;

    public AnomalyDetector(List<AnomalyAlgorithm> algorithms) {
        this.algorithmMap = new EnumMap<>(DetectionMethod.class);

        // Auto-register all algorithm implementations
        for (AnomalyAlgorithm algorithm : algorithms) {
            algorithmMap.put(algorithm.getSupportedMethod(), algorithm);
            log.info("Registered detection algorithm: {} -> {}",
                    algorithm.getSupportedMethod(), algorithm.getClass().getSimpleName());
        }
    }

    /**
     * Returns a copy of the configuration with every unset field defaulted.
     * The input is left untouched.
     */
    public DetectionConfig validateConfig(DetectionConfig config) {
        DetectionConfig validated = config.toBuilder().build();

        if (validated.getDetectionMethod() == null) {
            validated.setDetectionMethod(DEFAULT_METHOD);
        }
        if (validated.getSensitivity() == null) {
            validated.setSensitivity(DEFAULT_SENSITIVITY);
        }
        if (validated.getMinDataPoints() == null) {
            validated.setMinDataPoints(DEFAULT_MIN_DATA_POINTS);
        }
        if (validated.getBaselineWindowDays() == null) {
            validated.setBaselineWindowDays(DEFAULT_BASELINE_WINDOW_DAYS);
        }

        Map<String, Object> params = validated.getConfigParams() == null
                ? new HashMap<>()
                : new HashMap<>(validated.getConfigParams());
        if (DetectionMethod.MOVING_AVERAGE.getCode().equals(validated.getDetectionMethod())
                && !params.containsKey("window")) {
            params.put("window", AlgorithmParams.DEFAULT_MOVING_AVERAGE_WINDOW);
        }
        validated.setConfigParams(params);

        return validated;
    }

    /**
     * Detect anomalies in a metric history according to a configuration.
     *
     * @param config  the detection configuration
     * @param metrics historical metric points in any order
     * @return anomalous points only; empty when data is insufficient or the config is unusable
     */
    @Observed(name = "detection.detect", contextualName = "detect-anomalies")
    public List<AnomalyResult> detectAnomalies(DetectionConfig config, List<MetricPoint> metrics) {
        List<MetricPoint> sorted = new ArrayList<>(metrics);
        sorted.sort(Comparator.comparing(m -> m.getTimestamp() == null ? "" : m.getTimestamp()));

        List<Double> values = new ArrayList<>(sorted.size());
        List<String> timestamps = new ArrayList<>(sorted.size());
        for (MetricPoint metric : sorted) {
            Double value = extractValue(metric);
            if (value == null) {
                continue;
            }
            values.add(value);
            timestamps.add(metric.getTimestamp() == null ? "" : metric.getTimestamp());
        }

        int minDataPoints = config.getMinDataPoints() != null ? config.getMinDataPoints() : DEFAULT_MIN_DATA_POINTS;
        if (values.size() < minDataPoints) {
            log.info("Not enough data points for detection on config {}: {} < {}",
                    config.getId(), values.size(), minDataPoints);
            return Collections.emptyList();
        }

        String methodCode = config.getDetectionMethod() != null ? config.getDetectionMethod() : DEFAULT_METHOD;
        Optional<DetectionMethod> method = DetectionMethod.fromCode(methodCode);
        if (method.isEmpty()) {
            log.error("Unknown detection method '{}' on config {}", methodCode, config.getId());
            return Collections.emptyList();
        }

        AnomalyAlgorithm algorithm = algorithmMap.get(method.get());
        if (algorithm == null) {
            log.error("No algorithm registered for detection method {}, config {}", method.get(), config.getId());
            return Collections.emptyList();
        }

        double sensitivity = config.getSensitivity() != null ? config.getSensitivity() : DEFAULT_SENSITIVITY;
        if (!(sensitivity > 0.0)) {
            log.error("Invalid sensitivity {} on config {}", sensitivity, config.getId());
            return Collections.emptyList();
        }

        double[] series = values.stream().mapToDouble(Double::doubleValue).toArray();
        List<RawScore> rawScores = algorithm.detect(series, sensitivity, AlgorithmParams.from(method.get(), config));

        return ResultFormatter.format(rawScores, series, timestamps, method.get().getCode());
    }

    // Numeric value first, then text coerced to a number; null means skip the point
    private Double extractValue(MetricPoint metric) {
        if (metric.getMetricValue() != null) {
            return metric.getMetricValue();
        }
        if (metric.getMetricText() != null) {
            try {
                return Double.parseDouble(metric.getMetricText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
