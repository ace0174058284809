package com.metricwatch.anomaly.engine;

import com.metricwatch.anomaly.model.DetectionMethod;
import com.metricwatch.anomaly.model.Severity;

/**
 * Maps an anomaly score to a severity tier. Cutoffs are per method and fixed;
 * an unrecognised method falls back to the generic cutoffs.
 */
public final class SeverityClassifier {

    private SeverityClassifier() {}

    public static Severity classify(double score, DetectionMethod method) {
        return classify(score, method.getCode());
    }

    public static Severity classify(double score, String method) {
        String code = method == null ? "" : method;
        switch (code) {
            case "zscore":
                return tier(score, 5.0, 3.5);
            case "iqr":
                return tier(score, 3.0, 1.5);
            case "moving_average":
                return tier(score, 4.0, 2.5);
            default:
                return tier(score, 5.0, 2.5);
        }
    }

    private static Severity tier(double score, double highAbove, double mediumAbove) {
        if (score > highAbove) return Severity.HIGH;
        if (score > mediumAbove) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
