package com.metricwatch.anomaly.engine;

import com.metricwatch.anomaly.model.DetectionConfig;
import com.metricwatch.anomaly.model.DetectionMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Window parameters of a detection method. A null window means the whole series
 * for z-score and IQR; moving average always has one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlgorithmParams {

    public static final int DEFAULT_MOVING_AVERAGE_WINDOW = 7;

    private Integer window;

    // Moving average only; defaults to window
    private Integer stdWindow;

    public static AlgorithmParams none() {
        return new AlgorithmParams();
    }

    public static AlgorithmParams from(DetectionMethod method, DetectionConfig config) {
        Integer window = config.getParamAsInteger("window");
        switch (method) {
            case MOVING_AVERAGE:
                return AlgorithmParams.builder()
                        .window(window != null ? window : DEFAULT_MOVING_AVERAGE_WINDOW)
                        .stdWindow(config.getParamAsInteger("std_window"))
                        .build();
            case ZSCORE:
            case IQR:
            default:
                return AlgorithmParams.builder().window(window).build();
        }
    }
}
