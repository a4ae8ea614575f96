package com.z254.sentinel.detection;

import java.util.Arrays;
import java.util.Optional;

/**
 * Pure statistics over an ordered window of sample values.
 * <p>
 * Quartiles are index based (no interpolation) and variance is the population variance.
 * An empty window yields no statistics, which callers treat as "not trained".
 */
public final class StatsEngine {

    private StatsEngine() {
    }

    public static Optional<Statistics> compute(double[] values) {
        int n = values.length;
        if (n == 0) {
            return Optional.empty();
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double mean = mean(values);
        double variance = 0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        variance /= n;

        double q1 = sorted[(int) Math.floor(n * 0.25)];
        double median = sorted[(int) Math.floor(n * 0.5)];
        double q3 = sorted[(int) Math.floor(n * 0.75)];

        return Optional.of(new Statistics(
                n,
                mean,
                Math.sqrt(variance),
                sorted[0],
                sorted[n - 1],
                median,
                q1,
                q3,
                q3 - q1));
    }

    /**
     * Median absolute deviation: element at {@code floor(n / 2)} of the sorted
     * absolute deviations from {@code median}. Zero for an empty window.
     */
    public static double medianAbsoluteDeviation(double[] values, double median) {
        if (values.length == 0) {
            return 0;
        }
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        Arrays.sort(deviations);
        return deviations[deviations.length / 2];
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Least-squares slope of the values against their index. Zero for fewer than two values.
     */
    public static double slope(double[] values) {
        int n = values.length;
        if (n < 2) {
            return 0;
        }
        double xMean = (n - 1) / 2.0;
        double yMean = mean(values);
        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            numerator += (i - xMean) * (values[i] - yMean);
            denominator += (i - xMean) * (i - xMean);
        }
        return denominator == 0 ? 0 : numerator / denominator;
    }

    /**
     * Last {@code count} values (or all of them when fewer are available).
     */
    public static double[] tail(double[] values, int count) {
        int from = Math.max(0, values.length - count);
        return Arrays.copyOfRange(values, from, values.length);
    }
}
