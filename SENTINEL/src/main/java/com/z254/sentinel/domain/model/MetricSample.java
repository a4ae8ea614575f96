package com.z254.sentinel.domain.model;

import java.time.Instant;

/**
 * A single observation of a metric. The only unit of input to detection.
 */
public record MetricSample(String metric, Instant timestamp, double value) {
}
