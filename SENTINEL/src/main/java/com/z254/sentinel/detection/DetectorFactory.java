package com.z254.sentinel.detection;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.DetectorConfig;
import com.z254.sentinel.domain.model.MetricSample;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Builds a {@link TrainedDetector} for a config from a training series.
 */
@Component
public class DetectorFactory {

    private final ZoneId zone;
    private final Clock clock;

    public DetectorFactory(SentinelProperties properties, Clock clock) {
        this.zone = ZoneId.of(properties.getDetection().getZone());
        this.clock = clock;
    }

    /**
     * Train the configured algorithm. Empty when the series has fewer than
     * {@code minDataPoints} samples.
     */
    public Optional<TrainedDetector> train(DetectorConfig config, List<MetricSample> series) {
        if (series.isEmpty() || series.size() < config.getMinDataPoints()) {
            return Optional.empty();
        }
        double[] values = series.stream().mapToDouble(MetricSample::value).toArray();

        Optional<? extends AnomalyDetector> detector = switch (config.getAlgorithm()) {
            case SEASONAL_HYBRID -> SeasonalDetector.train(config, series, zone);
            case STATISTICAL -> StatisticalDetector.train(config, values);
        };

        ForecastModel forecastModel = config.getPrediction().isEnabled() ? new ForecastModel(values) : null;

        return detector.map(d -> new TrainedDetector(d, forecastModel, values.length, clock.instant()));
    }
}
