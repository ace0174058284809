package com.metricwatch.anomaly.engine;

import com.metricwatch.anomaly.model.AnomalyResult;
import com.metricwatch.anomaly.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultFormatterTest {

    private static final double[] VALUES = {1.0, 2.0, 30.0};
    private static final List<String> TIMESTAMPS = List.of("t0", "t1", "t2");

    @Test
    void keepsOnlyAnomalies_joinedWithValueAndTimestamp() {
        List<RawScore> raw = List.of(
                new RawScore(0, 0.1, false, 3.0),
                new RawScore(2, 6.2, true, 3.0));

        List<AnomalyResult> results = ResultFormatter.format(raw, VALUES, TIMESTAMPS, "zscore");

        assertThat(results).hasSize(1);
        AnomalyResult result = results.get(0);
        assertThat(result.getIndex()).isEqualTo(2);
        assertThat(result.getTimestamp()).isEqualTo("t2");
        assertThat(result.getValue()).isEqualTo(30.0);
        assertThat(result.getScore()).isEqualTo(6.2);
        assertThat(result.getThreshold()).isEqualTo(3.0);
        assertThat(result.getMethod()).isEqualTo("zscore");
        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void outOfRangeIndex_isDroppedNotFatal() {
        List<RawScore> raw = List.of(
                new RawScore(5, 9.0, true, 3.0),
                new RawScore(-1, 9.0, true, 3.0),
                new RawScore(1, 4.0, true, 3.0));

        List<AnomalyResult> results = ResultFormatter.format(raw, VALUES, TIMESTAMPS, "zscore");

        assertThat(results).extracting(AnomalyResult::getIndex).containsExactly(1);
        assertThat(results.get(0).getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void noAnomalies_returnsEmpty() {
        assertThat(ResultFormatter.format(List.of(new RawScore(0, 0.0, false, 1.5)), VALUES, TIMESTAMPS, "iqr"))
                .isEmpty();
    }
}
