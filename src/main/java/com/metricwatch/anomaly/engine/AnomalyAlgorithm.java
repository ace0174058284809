package com.metricwatch.anomaly.engine;

import com.metricwatch.anomaly.model.DetectionMethod;

import java.util.List;

/**
 * Interface for all statistical detection algorithms.
 * Each implementation handles one {@link DetectionMethod}.
 */
public interface AnomalyAlgorithm {

    /**
     * The detection method this algorithm implements.
     */
    DetectionMethod getSupportedMethod();

    /**
     * Score every evaluable point of a chronologically ordered series.
     *
     * @param values      the series, oldest first
     * @param sensitivity divisor of the method's base threshold, must be positive
     * @param params      window parameters resolved from the configuration
     * @return one score per evaluated point, empty when there is not enough data
     */
    List<RawScore> detect(double[] values, double sensitivity, AlgorithmParams params);
}
