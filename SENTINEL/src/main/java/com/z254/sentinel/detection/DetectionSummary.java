package com.z254.sentinel.detection;

import com.z254.sentinel.domain.model.Severity;

import java.util.Map;

/**
 * Counts over the detectors and the anomaly log; {@code recentAnomalies} covers the configured
 * summary window.
 */
public record DetectionSummary(
        int detectors,
        int readyDetectors,
        long totalAnomalies,
        long recentAnomalies,
        Map<Severity, Long> bySeverity,
        Map<String, Long> byMetric
) {
}
