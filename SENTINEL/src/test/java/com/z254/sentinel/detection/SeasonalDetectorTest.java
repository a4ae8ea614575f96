package com.z254.sentinel.detection;

import com.z254.sentinel.domain.model.*;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SeasonalDetectorTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private final DetectorConfig config = DetectorConfig.builder()
            .id("traffic")
            .metric("requests")
            .algorithm(AnomalyAlgorithm.SEASONAL_HYBRID)
            .seasonality(DetectorConfig.Seasonality.builder().enabled(true).period(24).build())
            .build();

    private static double daily(int hour) {
        return 100 + 10 * Math.sin(2 * Math.PI * hour / 24);
    }

    private static List<MetricSample> hours(int from, int to) {
        return IntStream.range(from, to)
                .mapToObj(hour -> new MetricSample("requests", START.plus(Duration.ofHours(hour)), daily(hour)))
                .toList();
    }

    private static List<MetricSample> twoDays() {
        return hours(0, 48);
    }

    private static double[] values(List<MetricSample> series) {
        return series.stream().mapToDouble(MetricSample::value).toArray();
    }

    private static int[] phases(List<MetricSample> series) {
        return series.stream().mapToInt(s -> SeasonalDetector.phase(s.timestamp(), ZoneOffset.UTC, 24)).toArray();
    }

    @Test
    void nextCycleOfTheSamePatternIsNormalAtEveryPhase() {
        SeasonalDetector detector = SeasonalDetector.train(config, twoDays(), ZoneOffset.UTC).orElseThrow();
        assertThat(detector.isSeasonal()).isTrue();

        for (int hour = 48; hour < 72; hour++) {
            MetricSample sample = new MetricSample("requests", START.plus(Duration.ofHours(hour)), daily(hour));
            assertThat(detector.detect(sample)).as("hour %d", hour).isEmpty();
        }
    }

    @Test
    void trainingWindowStartingMidCycleKeepsPhasesAligned() {
        SeasonalDetector detector = SeasonalDetector.train(config, hours(13, 61), ZoneOffset.UTC).orElseThrow();
        SeasonalModel model = detector.model().orElseThrow();

        for (int hour = 61; hour < 85; hour++) {
            MetricSample sample = new MetricSample("requests", START.plus(Duration.ofHours(hour)), daily(hour));
            assertThat(detector.detect(sample)).as("hour %d", hour).isEmpty();
        }
        assertThat(model.seasonalAt(6)).isGreaterThan(model.seasonalAt(18));

        Instant evening = START.plus(Duration.ofHours(66));
        double sigma = model.residualStdDev();
        assertThat(detector.detect(new MetricSample("requests", evening, daily(66) + 4 * sigma))).isPresent();
    }

    @Test
    void shiftOfThreeResidualDeviationsIsSeasonalAnomaly() {
        SeasonalDetector detector = SeasonalDetector.train(config, twoDays(), ZoneOffset.UTC).orElseThrow();
        SeasonalModel model = detector.model().orElseThrow();
        double sigma = model.residualStdDev();
        Instant noon = START.plus(Duration.ofHours(60));

        Anomaly high = detector.detect(new MetricSample("requests", noon, daily(60) + 3 * sigma)).orElseThrow();
        Anomaly low = detector.detect(new MetricSample("requests", noon, daily(60) - 3 * sigma)).orElseThrow();

        assertThat(high.getType()).isEqualTo(AnomalyType.SEASONAL);
        assertThat(high.getAlgorithm()).isEqualTo(AnomalyAlgorithm.SEASONAL_HYBRID);
        assertThat(high.getExpectedValue()).isCloseTo(model.expected(12), within(1e-9));
        assertThat(high.getScore()).isBetween(0.74, 0.76);
        assertThat(high.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(high.getContext().getSeasonalPattern()).hasSize(24);
        assertThat(low.getScore()).isBetween(0.74, 0.76);
    }

    @Test
    void seasonalComponentsAreCenteredOnZero() {
        SeasonalModel model = SeasonalModel.build(values(twoDays()), phases(twoDays()), 24).orElseThrow();

        double sum = model.seasonalPattern().stream().mapToDouble(Double::doubleValue).sum();
        assertThat(sum).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void modelNeedsTwoFullPeriods() {
        List<MetricSample> short_ = hours(0, 47);

        assertThat(SeasonalModel.build(values(short_), phases(short_), 24)).isEmpty();
        assertThat(SeasonalDetector.train(config, short_, ZoneOffset.UTC).orElseThrow().isSeasonal()).isFalse();
    }

    @Test
    void disabledSeasonalityFallsBackToStatisticalDetection() {
        DetectorConfig plain = config.toBuilder()
                .seasonality(DetectorConfig.Seasonality.builder().enabled(false).build())
                .build();
        SeasonalDetector detector = SeasonalDetector.train(plain, twoDays(), ZoneOffset.UTC).orElseThrow();

        Anomaly anomaly = detector.detect(new MetricSample("requests", START, 500)).orElseThrow();

        assertThat(detector.isSeasonal()).isFalse();
        assertThat(detector.algorithm()).isEqualTo(AnomalyAlgorithm.SEASONAL_HYBRID);
        assertThat(anomaly.getAlgorithm()).isEqualTo(AnomalyAlgorithm.STATISTICAL);
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.POINT);
    }
}
