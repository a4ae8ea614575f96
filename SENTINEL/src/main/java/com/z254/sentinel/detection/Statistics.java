package com.z254.sentinel.detection;

/**
 * Summary statistics of a training window.
 *
 * @param count  number of values
 * @param mean   arithmetic mean
 * @param stdDev population standard deviation
 * @param median element at {@code floor(n * 0.5)} of the sorted values
 * @param q1     element at {@code floor(n * 0.25)}
 * @param q3     element at {@code floor(n * 0.75)}
 * @param iqr    {@code q3 - q1}
 */
public record Statistics(
        int count,
        double mean,
        double stdDev,
        double min,
        double max,
        double median,
        double q1,
        double q3,
        double iqr
) {
}
