package com.metricwatch.anomaly.engine;

import java.util.Arrays;

/**
 * Descriptive statistics over half-open ranges of a series.
 * Standard deviation is the population form (divides by n).
 */
public final class Statistics {

    private Statistics() {}

    public static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    public static double std(double[] values, int from, int to) {
        double mean = mean(values, from, to);
        double sq = 0.0;
        for (int i = from; i < to; i++) {
            double d = values[i] - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / (to - from));
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param pct percentile in [0, 100]
     */
    public static double percentile(double[] values, int from, int to, double pct) {
        double[] sorted = Arrays.copyOfRange(values, from, to);
        Arrays.sort(sorted);
        double rank = (sorted.length - 1) * pct / 100.0;
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }
}
