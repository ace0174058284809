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
 * Flags points that lie too many standard deviations from the mean.
 *
 * Logic: score = |value - mean| / std, anomalous when score > 3.0 / sensitivity.
 * Without a window (or with one at least as long as the series) mean and std
 * come from the whole series and every point is scored. With a window, each
 * point from index {@code window} on is scored against the {@code window}
 * points before it; the unwindowed prefix is not emitted.
 *
 * A zero standard deviation scores 0.
 */
@Component
public class ZScoreAlgorithm implements AnomalyAlgorithm {

    static final double BASE_THRESHOLD = 3.0;

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.ZSCORE;
    }

    @Override
    public List<RawScore> detect(double[] values, double sensitivity, AlgorithmParams params) {
        return detect(values, sensitivity, params.getWindow());
    }

    public List<RawScore> detect(double[] values, double sensitivity, Integer window) {
        requirePositive(sensitivity);
        if (values.length < 2) {
            return Collections.emptyList();
        }

        double threshold = BASE_THRESHOLD / sensitivity;
        List<RawScore> results = new ArrayList<>(values.length);

        if (window == null || window <= 0 || window >= values.length) {
            double mean = Statistics.mean(values, 0, values.length);
            double std = Statistics.std(values, 0, values.length);
            for (int i = 0; i < values.length; i++) {
                results.add(score(i, values[i], mean, std, threshold));
            }
            return results;
        }

        for (int i = window; i < values.length; i++) {
            double mean = Statistics.mean(values, i - window, i);
            double std = Statistics.std(values, i - window, i);
            results.add(score(i, values[i], mean, std, threshold));
        }
        return results;
    }

    private RawScore score(int index, double value, double mean, double std, double threshold) {
        double score = std == 0.0 ? 0.0 : Math.abs((value - mean) / std);
        return new RawScore(index, score, score > threshold, threshold);
    }

    static void requirePositive(double sensitivity) {
        if (!(sensitivity > 0.0)) {
            throw new IllegalArgumentException("sensitivity must be > 0, got " + sensitivity);
        }
    }
}
