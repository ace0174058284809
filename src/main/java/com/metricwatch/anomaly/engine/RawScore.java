package com.metricwatch.anomaly.engine;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Per-point output of a detection algorithm, before it is joined with
 * timestamps and values.
 */
@Data
@AllArgsConstructor
public class RawScore {

    private final int index;
    private final double score;
    private final boolean anomaly;
    private final double threshold;
}
