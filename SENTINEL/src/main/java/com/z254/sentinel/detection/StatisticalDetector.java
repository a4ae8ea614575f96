package com.z254.sentinel.detection;

import com.z254.sentinel.domain.model.Anomaly;
import com.z254.sentinel.domain.model.AnomalyAlgorithm;
import com.z254.sentinel.domain.model.AnomalyType;
import com.z254.sentinel.domain.model.DetectorConfig;
import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.Severity;
import com.z254.sentinel.domain.model.TrendDirection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Point anomaly detector voting with Z-score, IQR fences and modified Z-score.
 * <p>
 * A sample is anomalous when at least one of the three votes fires. The score is the
 * larger of {@code z / 5} and {@code |modifiedZ| / 5}, capped at 1, and the confidence is
 * the fraction of votes that fired.
 */
public final class StatisticalDetector implements AnomalyDetector {

    static final double Z_THRESHOLD = 3.0;
    static final double IQR_MULTIPLIER = 1.5;
    static final double MODIFIED_Z_THRESHOLD = 3.5;
    static final double MODIFIED_Z_FACTOR = 0.6745;
    static final double SCORE_DIVISOR = 5.0;
    static final int TREND_WINDOW = 10;
    static final double TREND_STABLE_BAND = 0.1;

    private final DetectorConfig config;
    private final Statistics statistics;
    private final double mad;
    private final TrendDirection trend;

    private StatisticalDetector(DetectorConfig config, Statistics statistics, double mad, TrendDirection trend) {
        this.config = config;
        this.statistics = statistics;
        this.mad = mad;
        this.trend = trend;
    }

    /**
     * Train on an ordered window of values. Empty when there are no values.
     */
    public static Optional<StatisticalDetector> train(DetectorConfig config, double[] values) {
        return StatsEngine.compute(values).map(stats -> new StatisticalDetector(
                config,
                stats,
                StatsEngine.medianAbsoluteDeviation(values, stats.median()),
                detectTrend(values)));
    }

    @Override
    public AnomalyAlgorithm algorithm() {
        return AnomalyAlgorithm.STATISTICAL;
    }

    @Override
    public int sampleCount() {
        return statistics.count();
    }

    public Statistics statistics() {
        return statistics;
    }

    public double mad() {
        return mad;
    }

    public TrendDirection trend() {
        return trend;
    }

    @Override
    public Optional<Anomaly> detect(MetricSample sample) {
        double value = sample.value();
        double mean = statistics.mean();
        double stdDev = statistics.stdDev();

        // Z-score vote; a flat window flags any departure from the mean
        double zScore;
        boolean zVote;
        if (stdDev > 0) {
            zScore = Math.abs(value - mean) / stdDev;
            zVote = zScore > Z_THRESHOLD;
        } else {
            zVote = value != mean;
            zScore = zVote ? SCORE_DIVISOR : 0;
        }

        double lowerFence = statistics.q1() - IQR_MULTIPLIER * statistics.iqr();
        double upperFence = statistics.q3() + IQR_MULTIPLIER * statistics.iqr();
        boolean iqrVote = value < lowerFence || value > upperFence;

        double modifiedZ;
        boolean modifiedZVote;
        if (mad > 0) {
            modifiedZ = MODIFIED_Z_FACTOR * (value - statistics.median()) / mad;
            modifiedZVote = Math.abs(modifiedZ) > MODIFIED_Z_THRESHOLD;
        } else {
            modifiedZVote = value != statistics.median();
            modifiedZ = modifiedZVote ? SCORE_DIVISOR : 0;
        }

        int votes = (zVote ? 1 : 0) + (iqrVote ? 1 : 0) + (modifiedZVote ? 1 : 0);
        if (votes == 0) {
            return Optional.empty();
        }

        double score = Math.min(1.0, Math.max(zScore / SCORE_DIVISOR, Math.abs(modifiedZ) / SCORE_DIVISOR));
        Severity severity = config.getThresholds().classify(score);

        return Optional.of(Anomaly.builder()
                .detectorId(config.getId())
                .timestamp(sample.timestamp())
                .metric(config.getMetric())
                .algorithm(AnomalyAlgorithm.STATISTICAL)
                .type(AnomalyType.POINT)
                .severity(severity)
                .score(score)
                .confidence(votes / 3.0)
                .value(value)
                .expectedValue(mean)
                .deviation(Math.abs(value - mean))
                .context(Anomaly.Context.builder()
                        .historicalMean(mean)
                        .historicalStdDev(stdDev)
                        .trendDirection(trend)
                        .build())
                .recommendations(recommendations(value, mean, severity))
                .build());
    }

    // ========== Private Methods ==========

    private static TrendDirection detectTrend(double[] values) {
        if (values.length < TREND_WINDOW) {
            return TrendDirection.STABLE;
        }
        double[] recent = StatsEngine.tail(values, TREND_WINDOW);
        double[] firstHalf = Arrays.copyOfRange(recent, 0, TREND_WINDOW / 2);
        double[] secondHalf = Arrays.copyOfRange(recent, TREND_WINDOW / 2, TREND_WINDOW);

        double firstMean = StatsEngine.mean(firstHalf);
        double secondMean = StatsEngine.mean(secondHalf);

        // Relative to |firstMean| so negative series keep their direction; absolute around zero.
        double change = secondMean - firstMean;
        if (firstMean != 0) {
            change /= Math.abs(firstMean);
        }
        if (change > TREND_STABLE_BAND) return TrendDirection.UP;
        if (change < -TREND_STABLE_BAND) return TrendDirection.DOWN;
        return TrendDirection.STABLE;
    }

    static List<String> recommendations(double value, double expected, Severity severity) {
        List<String> recommendations = new ArrayList<>();

        if (severity.isAtLeast(Severity.HIGH)) {
            recommendations.add("Immediate investigation required");
            recommendations.add("Check system logs for errors");
            recommendations.add("Verify external dependencies");
        }

        if (expected != 0) {
            double relative = (value - expected) / Math.abs(expected);
            if (relative > 1.0) {
                recommendations.add("Resource scaling may be needed");
                recommendations.add("Check for traffic spikes or unusual load");
            } else if (relative < -0.5) {
                recommendations.add("Check for service degradation or outages");
                recommendations.add("Verify monitoring system is functioning");
            }
        }

        return recommendations;
    }
}
