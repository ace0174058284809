package com.metricwatch.anomaly.engine.algorithms;

import com.metricwatch.anomaly.engine.AlgorithmParams;
import com.metricwatch.anomaly.engine.AnomalyAlgorithm;
import com.metricwatch.anomaly.engine.RawScore;
import com.metricwatch.anomaly.engine.Statistics;
import com.metricwatch.anomaly.model.DetectionMethod;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Flags points that deviate from the trailing moving average.
 *
 * Logic: for each index i >= window, ma[i] is the mean of the {@code window}
 * values before i. The spread is the standard deviation of the moving-average
 * series itself: one global std when there are fewer averages than
 * {@code stdWindow}, otherwise a rolling std over {@code stdWindow} averages,
 * with the last rolling std reused for the tail it does not cover.
 * score = |value - ma| / std, anomalous when score > 2.0 / sensitivity.
 * A zero std scores 0 and is never anomalous.
 */
@Component
public class MovingAverageAlgorithm implements AnomalyAlgorithm {

    static final double BASE_THRESHOLD = 2.0;

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.MOVING_AVERAGE;
    }

    @Override
    public List<RawScore> detect(double[] values, double sensitivity, AlgorithmParams params) {
        int window = params.getWindow() != null ? params.getWindow() : AlgorithmParams.DEFAULT_MOVING_AVERAGE_WINDOW;
        return detect(values, sensitivity, window, params.getStdWindow());
    }

    public List<RawScore> detect(double[] values, double sensitivity, int window, Integer stdWindow) {
        ZScoreAlgorithm.requirePositive(sensitivity);
        if (window < 1 || values.length < window + 1) {
            return Collections.emptyList();
        }
        int spreadWindow = (stdWindow == null || stdWindow < 1) ? window : stdWindow;

        double[] movingAvgs = new double[values.length - window];
        for (int i = window; i < values.length; i++) {
            movingAvgs[i - window] = Statistics.mean(values, i - window, i);
        }

        double[] stds;
        if (movingAvgs.length < spreadWindow) {
            double std = Statistics.std(movingAvgs, 0, movingAvgs.length);
            stds = new double[movingAvgs.length];
            Arrays.fill(stds, std);
        } else {
            stds = new double[movingAvgs.length - spreadWindow + 1];
            for (int i = spreadWindow; i <= movingAvgs.length; i++) {
                stds[i - spreadWindow] = Statistics.std(movingAvgs, i - spreadWindow, i);
            }
        }

        double threshold = BASE_THRESHOLD / sensitivity;
        List<RawScore> results = new ArrayList<>(movingAvgs.length);

        for (int i = 0; i < movingAvgs.length; i++) {
            int actualIdx = i + window;
            double currentStd = i < stds.length ? stds[i] : stds[stds.length - 1];

            if (currentStd == 0.0) {
                results.add(new RawScore(actualIdx, 0.0, false, threshold));
            } else {
                double score = Math.abs((values[actualIdx] - movingAvgs[i]) / currentStd);
                results.add(new RawScore(actualIdx, score, score > threshold, threshold));
            }
        }
        return results;
    }
}
