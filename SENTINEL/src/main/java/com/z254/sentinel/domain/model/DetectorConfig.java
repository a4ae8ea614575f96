package com.z254.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of a named anomaly detector bound to one metric.
 * <p>
 * Instances are treated as values: updates replace the stored config instead of
 * mutating it, so detection and training loops always see a consistent snapshot.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DetectorConfig {

    private String id;

    private String name;

    private String metric;

    @Builder.Default
    private AnomalyAlgorithm algorithm = AnomalyAlgorithm.STATISTICAL;

    @Builder.Default
    private boolean enabled = true;

    /** Sensitivity (0.0 to 1.0, higher = more sensitive) */
    @Builder.Default
    private double sensitivity = 0.7;

    /** Samples required before a trained detector is used */
    @Builder.Default
    private int minDataPoints = 30;

    /** History pulled for each training run */
    @Builder.Default
    private Duration trainingWindow = Duration.ofDays(7);

    @Builder.Default
    private Duration detectionWindow = Duration.ofMinutes(5);

    @Builder.Default
    private Seasonality seasonality = new Seasonality();

    @Builder.Default
    private Thresholds thresholds = new Thresholds();

    @Builder.Default
    private PredictionSettings prediction = new PredictionSettings();

    @Builder.Default
    private AlertingSettings alerting = new AlertingSettings();

    @Builder.Default
    private Map<String, String> tags = new HashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Seasonality {
        @Builder.Default
        private boolean enabled = false;

        /** Period in samples (24 for an hourly series with a daily cycle) */
        @Builder.Default
        private int period = 24;

        @Builder.Default
        private List<String> components = new ArrayList<>(List.of("trend", "seasonal", "residual"));
    }

    /**
     * Score cut points (0.0 to 1.0). Lower bounds are inclusive.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Thresholds {
        @Builder.Default
        private double low = 0.3;
        @Builder.Default
        private double medium = 0.5;
        @Builder.Default
        private double high = 0.7;
        @Builder.Default
        private double critical = 0.9;

        public Severity classify(double score) {
            if (score >= critical) return Severity.CRITICAL;
            if (score >= high) return Severity.HIGH;
            if (score >= medium) return Severity.MEDIUM;
            return Severity.LOW;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PredictionSettings {
        @Builder.Default
        private boolean enabled = false;

        /** Number of one-minute points to forecast */
        @Builder.Default
        private int horizon = 30;

        /** Minimum backtested confidence for a forecast to be attached */
        @Builder.Default
        private double confidence = 0.6;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AlertingSettings {
        @Builder.Default
        private boolean enabled = false;

        /** Minutes between two alerts from the same detector */
        @Builder.Default
        private int cooldown = 15;

        @Builder.Default
        private List<NotificationChannel> channels = new ArrayList<>();

        @Builder.Default
        private Map<NotificationChannel, List<String>> recipients = new HashMap<>();

        @Builder.Default
        private boolean escalation = false;
    }
}
