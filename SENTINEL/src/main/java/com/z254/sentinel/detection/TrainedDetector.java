package com.z254.sentinel.detection;

import java.time.Instant;
import java.util.Optional;

/**
 * Result of one training run. Replaced wholesale on every retrain.
 *
 * @param detector      the trained classifier
 * @param forecastModel present when prediction is enabled for the detector
 * @param sampleCount   number of training samples
 * @param trainedAt     completion time of the run
 */
public record TrainedDetector(
        AnomalyDetector detector,
        ForecastModel forecastModel,
        int sampleCount,
        Instant trainedAt
) {

    public Optional<ForecastModel> forecast() {
        return Optional.ofNullable(forecastModel);
    }

    public boolean isUsable(int minDataPoints) {
        return sampleCount >= minDataPoints;
    }
}
