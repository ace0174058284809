package com.metricwatch.anomaly.engine;

import com.metricwatch.anomaly.model.AnomalyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Joins raw algorithm output with the evaluated values and their timestamps,
 * keeping only anomalous points.
 */
public final class ResultFormatter {

    private static final Logger log = LoggerFactory.getLogger(ResultFormatter.class);

    private ResultFormatter() {}

    public static List<AnomalyResult> format(List<RawScore> rawScores,
                                             double[] values,
                                             List<String> timestamps,
                                             String method) {
        List<AnomalyResult> formatted = new ArrayList<>();

        for (RawScore raw : rawScores) {
            if (!raw.isAnomaly()) {
                continue;
            }
            int idx = raw.getIndex();
            if (idx < 0 || idx >= values.length || idx >= timestamps.size()) {
                log.warn("Index {} out of bounds for values/timestamps with lengths {}/{}",
                        idx, values.length, timestamps.size());
                continue;
            }

            formatted.add(AnomalyResult.builder()
                    .index(idx)
                    .timestamp(timestamps.get(idx))
                    .value(values[idx])
                    .score(raw.getScore())
                    .anomaly(true)
                    .threshold(raw.getThreshold())
                    .method(method)
                    .severity(SeverityClassifier.classify(raw.getScore(), method))
                    .build());
        }

        return formatted;
    }
}
