package com.z254.sentinel.detection;

import com.z254.sentinel.domain.model.AnomalyAlgorithm;
import com.z254.sentinel.domain.model.DetectorConfig;

import java.time.Instant;

/**
 * Read-only view of a registered detector.
 *
 * @param activeAlgorithm algorithm of the trained model, which differs from the configured one
 *                        when a seasonal detector fell back to statistical detection
 */
public record DetectorInfo(
        DetectorConfig config,
        DetectorStatus status,
        int sampleCount,
        Instant trainedAt,
        AnomalyAlgorithm activeAlgorithm,
        Instant lastAlertAt
) {
}
