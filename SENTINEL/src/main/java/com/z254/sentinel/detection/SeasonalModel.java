package com.z254.sentinel.detection;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Additive decomposition of a series into trend, per-phase seasonal offsets and residual.
 * <p>
 * The trend is a centered moving average with window {@code min(24, n / 4)}; seasonal
 * offsets are the per-phase means of the detrended series re-centered to zero mean. Each
 * sample carries its own phase, taken from its timestamp, so the series may start anywhere
 * in the cycle.
 */
public final class SeasonalModel {

    static final int MAX_TREND_WINDOW = 24;

    private final int period;
    private final double[] trend;
    private final int[] phases;
    private final double[] seasonal;
    private final double[] residual;
    private final double residualStdDev;

    private SeasonalModel(int period, double[] trend, int[] phases, double[] seasonal, double[] residual) {
        this.period = period;
        this.trend = trend;
        this.phases = phases;
        this.seasonal = seasonal;
        this.residual = residual;
        this.residualStdDev = StatsEngine.compute(residual).map(Statistics::stdDev).orElse(0.0);
    }

    /**
     * Decompose {@code values}, where {@code phases[i]} is the phase of {@code values[i]}.
     * Empty unless there are at least two full periods.
     */
    public static Optional<SeasonalModel> build(double[] values, int[] phases, int period) {
        if (period < 1 || values.length < 2 * period) {
            return Optional.empty();
        }
        if (phases.length != values.length) {
            throw new IllegalArgumentException("Expected " + values.length + " phases but got " + phases.length);
        }
        int[] bucket = new int[phases.length];
        for (int i = 0; i < phases.length; i++) {
            bucket[i] = Math.floorMod(phases[i], period);
        }

        double[] trend = movingAverage(values, Math.min(MAX_TREND_WINDOW, values.length / 4));

        double[] detrended = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            detrended[i] = values[i] - trend[i];
        }

        double[] seasonal = new double[period];
        int[] counts = new int[period];
        for (int i = 0; i < detrended.length; i++) {
            seasonal[bucket[i]] += detrended[i];
            counts[bucket[i]]++;
        }
        for (int p = 0; p < period; p++) {
            seasonal[p] = counts[p] > 0 ? seasonal[p] / counts[p] : 0;
        }
        double seasonalMean = StatsEngine.mean(seasonal);
        for (int p = 0; p < period; p++) {
            seasonal[p] -= seasonalMean;
        }

        double[] residual = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            residual[i] = detrended[i] - seasonal[bucket[i]];
        }

        return Optional.of(new SeasonalModel(period, trend, bucket, seasonal, residual));
    }

    public int period() {
        return period;
    }

    public double residualStdDev() {
        return residualStdDev;
    }

    public double seasonalAt(int phase) {
        return seasonal[Math.floorMod(phase, period)];
    }

    /**
     * Most recent trend value at the given phase of the training series, or the last trend
     * value when no training sample fell on that phase.
     */
    public double trendTail(int phase) {
        int p = Math.floorMod(phase, period);
        for (int i = trend.length - 1; i >= 0; i--) {
            if (phases[i] == p) {
                return trend[i];
            }
        }
        return trend[trend.length - 1];
    }

    public double expected(int phase) {
        return trendTail(phase) + seasonalAt(phase);
    }

    public List<Double> seasonalPattern() {
        return Arrays.stream(seasonal).boxed().toList();
    }

    /**
     * Least-squares slope of the last ten trend values.
     */
    public double recentTrendSlope() {
        return StatsEngine.slope(StatsEngine.tail(trend, 10));
    }

    private static double[] movingAverage(double[] values, int window) {
        int half = window / 2;
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int start = Math.max(0, i - half);
            int end = Math.min(values.length, i + half + 1);
            double sum = 0;
            for (int j = start; j < end; j++) {
                sum += values[j];
            }
            result[i] = sum / (end - start);
        }
        return result;
    }
}
