package com.z254.sentinel.detection;

import com.z254.sentinel.domain.model.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.stream.DoubleStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatisticalDetectorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private final DetectorConfig config = DetectorConfig.builder()
            .id("latency")
            .metric("latency_ms")
            .build();

    /**
     * 50 x -1 and 50 x +1: mean 0, population stdDev 1, median 1, MAD 2, IQR fences at -4 and 4.
     */
    private StatisticalDetector unitSpreadDetector() {
        double[] values = DoubleStream.concat(
                DoubleStream.generate(() -> -1).limit(50),
                DoubleStream.generate(() -> 1).limit(50)).toArray();
        return StatisticalDetector.train(config, values).orElseThrow();
    }

    @Test
    void zScoreJustAboveThreeIsFlagged() {
        Optional<Anomaly> anomaly = unitSpreadDetector().detect(sample(3.0001));

        assertThat(anomaly).isPresent();
        assertThat(anomaly.get().getScore()).isCloseTo(0.60002, within(1e-6));
        assertThat(anomaly.get().getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(anomaly.get().getConfidence()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(anomaly.get().getType()).isEqualTo(AnomalyType.POINT);
        assertThat(anomaly.get().getAlgorithm()).isEqualTo(AnomalyAlgorithm.STATISTICAL);
        assertThat(anomaly.get().getExpectedValue()).isZero();
        assertThat(anomaly.get().getDeviation()).isCloseTo(3.0001, within(1e-9));
    }

    @Test
    void zScoreJustBelowThreeIsNormal() {
        assertThat(unitSpreadDetector().detect(sample(2.9999))).isEmpty();
    }

    @Test
    void scoreOfPointNineFiveIsCritical() {
        Anomaly anomaly = unitSpreadDetector().detect(sample(4.75)).orElseThrow();

        assertThat(anomaly.getScore()).isCloseTo(0.95, within(1e-9));
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
        // Z-score and IQR fire, modified Z does not
        assertThat(anomaly.getConfidence()).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(anomaly.getRecommendations()).contains("Immediate investigation required");
    }

    @Test
    void flatWindowFlagsAnyDeparture() {
        double[] flat = DoubleStream.generate(() -> 5).limit(20).toArray();
        StatisticalDetector detector = StatisticalDetector.train(config, flat).orElseThrow();

        assertThat(detector.detect(sample(5))).isEmpty();

        Anomaly anomaly = detector.detect(sample(6)).orElseThrow();
        assertThat(anomaly.getScore()).isEqualTo(1.0);
        assertThat(anomaly.getConfidence()).isEqualTo(1.0);
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void trendComparesHalvesOfLastTenSamples() {
        double[] rising = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};
        double[] steady = {10, 10.2, 9.9, 10.1, 10, 10, 9.8, 10.1, 10, 10.2};

        assertThat(StatisticalDetector.train(config, rising).orElseThrow().trend()).isEqualTo(TrendDirection.UP);
        assertThat(StatisticalDetector.train(config, steady).orElseThrow().trend()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void trendKeepsDirectionForNegativeAndZeroCenteredSeries() {
        double[] warming = {-20, -20, -20, -20, -20, -15, -15, -15, -15, -15};
        double[] cooling = {-15, -15, -15, -15, -15, -20, -20, -20, -20, -20};
        double[] aroundZero = {-1, 1, -1, 1, 0, 2, 3, 2, 3, 2};

        assertThat(StatisticalDetector.train(config, warming).orElseThrow().trend()).isEqualTo(TrendDirection.UP);
        assertThat(StatisticalDetector.train(config, cooling).orElseThrow().trend()).isEqualTo(TrendDirection.DOWN);
        assertThat(StatisticalDetector.train(config, aroundZero).orElseThrow().trend()).isEqualTo(TrendDirection.UP);
    }

    @Test
    void recommendationsFollowRelativeDeviation() {
        assertThat(StatisticalDetector.recommendations(250, 100, Severity.LOW))
                .containsExactly("Resource scaling may be needed", "Check for traffic spikes or unusual load");
        assertThat(StatisticalDetector.recommendations(40, 100, Severity.LOW))
                .containsExactly("Check for service degradation or outages", "Verify monitoring system is functioning");
        assertThat(StatisticalDetector.recommendations(120, 100, Severity.MEDIUM)).isEmpty();
    }

    @Test
    void noTrainingDataMeansNoDetector() {
        assertThat(StatisticalDetector.train(config, new double[0])).isEmpty();
    }

    private static MetricSample sample(double value) {
        return new MetricSample("latency_ms", NOW, value);
    }
}
