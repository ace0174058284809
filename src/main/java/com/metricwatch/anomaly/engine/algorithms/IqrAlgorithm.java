package com.metricwatch.anomaly.engine.algorithms;

import com.metricwatch.anomaly.engine.AlgorithmParams;
import com.metricwatch.anomaly.engine.AnomalyAlgorithm;
import com.metricwatch.anomaly.engine.RawScore;
import com.metricwatch.anomaly.engine.Statistics;
import com.metricwatch.anomaly.model.DetectionMethod;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flags points outside the interquartile fences.
 *
 * Logic: k = 1.5 / sensitivity, fences are [Q1 - k*IQR, Q3 + k*IQR]. A point
 * beyond a fence is anomalous and scores its distance past that fence in IQR
 * units (infinity when IQR is 0). Points inside the fences score 0.
 *
 * Example: [1..7] gives Q1=2.5, Q3=5.5, IQR=3, fences [-2.0, 10.0], so nothing
 * is flagged. Windowing follows {@link ZScoreAlgorithm}.
 */
@Component
public class IqrAlgorithm implements AnomalyAlgorithm {

    static final double BASE_THRESHOLD = 1.5;
    static final int MIN_POINTS = 4;

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.IQR;
    }

    @Override
    public List<RawScore> detect(double[] values, double sensitivity, AlgorithmParams params) {
        return detect(values, sensitivity, params.getWindow());
    }

    public List<RawScore> detect(double[] values, double sensitivity, Integer window) {
        ZScoreAlgorithm.requirePositive(sensitivity);
        if (values.length < MIN_POINTS) {
            return Collections.emptyList();
        }

        double threshold = BASE_THRESHOLD / sensitivity;
        List<RawScore> results = new ArrayList<>(values.length);

        if (window == null || window <= 0 || window >= values.length) {
            double q1 = Statistics.percentile(values, 0, values.length, 25);
            double q3 = Statistics.percentile(values, 0, values.length, 75);
            for (int i = 0; i < values.length; i++) {
                results.add(score(i, values[i], q1, q3, threshold));
            }
            return results;
        }

        for (int i = window; i < values.length; i++) {
            double q1 = Statistics.percentile(values, i - window, i, 25);
            double q3 = Statistics.percentile(values, i - window, i, 75);
            results.add(score(i, values[i], q1, q3, threshold));
        }
        return results;
    }

    private RawScore score(int index, double value, double q1, double q3, double threshold) {
        double iqr = q3 - q1;
        double lowerBound = q1 - iqr * threshold;
        double upperBound = q3 + iqr * threshold;

        if (value < lowerBound) {
            double score = iqr > 0 ? (lowerBound - value) / iqr : Double.POSITIVE_INFINITY;
            return new RawScore(index, score, true, threshold);
        }
        if (value > upperBound) {
            double score = iqr > 0 ? (value - upperBound) / iqr : Double.POSITIVE_INFINITY;
            return new RawScore(index, score, true, threshold);
        }
        return new RawScore(index, 0.0, false, threshold);
    }
}
