package com.z254.sentinel.metrics;

import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.MetricValue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Pull interface to the metric store polled by detectors and rules.
 * <p>
 * An unknown metric yields an empty result rather than an error. Implementations throw
 * {@link com.z254.sentinel.exception.EvaluationException} when the store itself cannot be reached.
 */
public interface MetricSource {

    Optional<MetricValue> getMetricValue(String metric);

    /**
     * Numeric samples with {@code start <= timestamp <= end}, oldest first.
     */
    List<MetricSample> getHistoricalSeries(String metric, Instant start, Instant end);
}
