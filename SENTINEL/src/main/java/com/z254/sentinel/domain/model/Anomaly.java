package com.z254.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A statistically abnormal metric sample. Never modified after it is logged.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Anomaly {

    private String id;

    /** Detector that produced the anomaly */
    private String detectorId;

    private Instant timestamp;

    private String metric;

    private AnomalyAlgorithm algorithm;

    private AnomalyType type;

    private Severity severity;

    /** Normalized magnitude (0.0 to 1.0) */
    private double score;

    /** Agreement between detection methods (0.0 to 1.0) */
    private double confidence;

    private double value;

    private double expectedValue;

    private double deviation;

    private Context context;

    /** Short-horizon forecast, present only when it met the detector's confidence floor */
    private Prediction prediction;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Context {
        private double historicalMean;
        private double historicalStdDev;
        private List<Double> seasonalPattern;
        private TrendDirection trendDirection;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Prediction {
        private List<Double> nextValues;
        /** Forecast horizon in minutes */
        private int timeHorizon;
        private double confidence;
    }
}
