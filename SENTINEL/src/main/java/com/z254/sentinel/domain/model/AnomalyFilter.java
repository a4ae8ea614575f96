package com.z254.sentinel.domain.model;

import java.time.Instant;

/**
 * Optional criteria for anomaly log queries. A {@code null} field matches everything;
 * the time range is inclusive on both ends.
 */
public record AnomalyFilter(
        String metric,
        Severity severity,
        AnomalyAlgorithm algorithm,
        Instant from,
        Instant to
) {

    public static AnomalyFilter all() {
        return new AnomalyFilter(null, null, null, null, null);
    }

    public boolean matches(Anomaly anomaly) {
        return (metric == null || metric.equals(anomaly.getMetric()))
                && (severity == null || severity == anomaly.getSeverity())
                && (algorithm == null || algorithm == anomaly.getAlgorithm())
                && (from == null || !anomaly.getTimestamp().isBefore(from))
                && (to == null || !anomaly.getTimestamp().isAfter(to));
    }
}
