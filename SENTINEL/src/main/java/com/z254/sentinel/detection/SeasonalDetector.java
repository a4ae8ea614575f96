package com.z254.sentinel.detection;

import com.z254.sentinel.domain.model.Anomaly;
import com.z254.sentinel.domain.model.AnomalyAlgorithm;
import com.z254.sentinel.domain.model.AnomalyType;
import com.z254.sentinel.domain.model.DetectorConfig;
import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.Severity;
import com.z254.sentinel.domain.model.TrendDirection;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Seasonal hybrid detector.
 * <p>
 * Compares a sample against {@code trendTail(phase) + seasonal[phase]}, where the phase is the
 * sample's hour of day modulo the configured period. When no seasonal model could be built
 * (seasonality disabled or fewer than two periods of data) every call is answered by a
 * {@link StatisticalDetector} trained on the same series.
 */
public final class SeasonalDetector implements AnomalyDetector {

    static final double Z_THRESHOLD = 2.5;
    static final double SCORE_DIVISOR = 4.0;
    static final double SLOPE_STABLE_BAND = 0.01;

    private final DetectorConfig config;
    private final ZoneId zone;
    private final SeasonalModel model;
    private final StatisticalDetector fallback;
    private final int sampleCount;

    private SeasonalDetector(DetectorConfig config, ZoneId zone, SeasonalModel model,
                             StatisticalDetector fallback, int sampleCount) {
        this.config = config;
        this.zone = zone;
        this.model = model;
        this.fallback = fallback;
        this.sampleCount = sampleCount;
    }

    public static Optional<SeasonalDetector> train(DetectorConfig config, List<MetricSample> series, ZoneId zone) {
        if (series.isEmpty()) {
            return Optional.empty();
        }
        double[] values = series.stream().mapToDouble(MetricSample::value).toArray();
        SeasonalModel model = null;
        if (config.getSeasonality().isEnabled()) {
            int period = config.getSeasonality().getPeriod();
            int[] phases = series.stream().mapToInt(sample -> phase(sample.timestamp(), zone, period)).toArray();
            model = SeasonalModel.build(values, phases, period).orElse(null);
        }
        StatisticalDetector fallback = model == null
                ? StatisticalDetector.train(config, values).orElseThrow()
                : null;
        return Optional.of(new SeasonalDetector(config, zone, model, fallback, values.length));
    }

    @Override
    public AnomalyAlgorithm algorithm() {
        return AnomalyAlgorithm.SEASONAL_HYBRID;
    }

    @Override
    public int sampleCount() {
        return sampleCount;
    }

    /**
     * Whether detection uses the seasonal model rather than the statistical fallback.
     */
    public boolean isSeasonal() {
        return model != null;
    }

    public Optional<SeasonalModel> model() {
        return Optional.ofNullable(model);
    }

    @Override
    public Optional<Anomaly> detect(MetricSample sample) {
        if (model == null) {
            return fallback.detect(sample);
        }

        double value = sample.value();
        int phase = phase(sample.timestamp(), zone, model.period());
        double expected = model.expected(phase);
        double residual = value - expected;
        double sigma = model.residualStdDev();

        double zScore;
        if (sigma > 0) {
            zScore = Math.abs(residual) / sigma;
        } else {
            zScore = residual == 0 ? 0 : SCORE_DIVISOR;
        }
        if (zScore <= Z_THRESHOLD) {
            return Optional.empty();
        }

        double score = Math.min(1.0, zScore / SCORE_DIVISOR);
        Severity severity = config.getThresholds().classify(score);

        return Optional.of(Anomaly.builder()
                .detectorId(config.getId())
                .timestamp(sample.timestamp())
                .metric(config.getMetric())
                .algorithm(AnomalyAlgorithm.SEASONAL_HYBRID)
                .type(AnomalyType.SEASONAL)
                .severity(severity)
                .score(score)
                .confidence(Math.min(1.0, zScore / 3.0))
                .value(value)
                .expectedValue(expected)
                .deviation(Math.abs(residual))
                .context(Anomaly.Context.builder()
                        .historicalMean(expected)
                        .historicalStdDev(sigma)
                        .seasonalPattern(model.seasonalPattern())
                        .trendDirection(trendDirection())
                        .build())
                .recommendations(recommendations(value, expected, severity))
                .build());
    }

    static int phase(Instant timestamp, ZoneId zone, int period) {
        return timestamp.atZone(zone).getHour() % period;
    }

    private TrendDirection trendDirection() {
        double slope = model.recentTrendSlope();
        if (slope > SLOPE_STABLE_BAND) return TrendDirection.UP;
        if (slope < -SLOPE_STABLE_BAND) return TrendDirection.DOWN;
        return TrendDirection.STABLE;
    }

    private static List<String> recommendations(double value, double expected, Severity severity) {
        List<String> recommendations = new ArrayList<>();

        if (severity.isAtLeast(Severity.HIGH)) {
            recommendations.add("Seasonal pattern deviation detected");
            recommendations.add("Compare with same time period in previous cycles");
        }

        if (expected != 0 && Math.abs((value - expected) / expected) > 0.5) {
            recommendations.add("Significant deviation from seasonal expectations");
            recommendations.add("Check for external factors affecting normal patterns");
        }

        return recommendations;
    }
}
