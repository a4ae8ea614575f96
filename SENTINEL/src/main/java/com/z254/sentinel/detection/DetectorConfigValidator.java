package com.z254.sentinel.detection;

import com.z254.sentinel.domain.model.DetectorConfig;
import com.z254.sentinel.exception.ConfigurationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects detector definitions that could never train or classify.
 */
@Component
public class DetectorConfigValidator {

    public void validate(DetectorConfig config) {
        List<String> violations = new ArrayList<>();

        if (isBlank(config.getId())) violations.add("id is required");
        if (isBlank(config.getMetric())) violations.add("metric is required");
        if (config.getAlgorithm() == null) violations.add("algorithm is required");
        if (config.getSensitivity() < 0 || config.getSensitivity() > 1) {
            violations.add("sensitivity must be within [0, 1]");
        }
        if (config.getMinDataPoints() < 1) violations.add("minDataPoints must be >= 1");
        if (config.getTrainingWindow() == null || config.getTrainingWindow().isNegative()
                || config.getTrainingWindow().isZero()) {
            violations.add("trainingWindow must be positive");
        }

        DetectorConfig.Seasonality seasonality = config.getSeasonality();
        if (seasonality != null && seasonality.isEnabled() && seasonality.getPeriod() < 2) {
            violations.add("seasonality.period must be >= 2");
        }

        DetectorConfig.Thresholds t = config.getThresholds();
        if (t == null) {
            violations.add("thresholds are required");
        } else if (!(0 <= t.getLow() && t.getLow() <= t.getMedium() && t.getMedium() <= t.getHigh()
                && t.getHigh() <= t.getCritical() && t.getCritical() <= 1)) {
            violations.add("thresholds must satisfy 0 <= low <= medium <= high <= critical <= 1");
        }

        DetectorConfig.PredictionSettings prediction = config.getPrediction();
        if (prediction != null && prediction.isEnabled()) {
            if (prediction.getHorizon() < 1) violations.add("prediction.horizon must be >= 1");
            if (prediction.getConfidence() < 0 || prediction.getConfidence() > 1) {
                violations.add("prediction.confidence must be within [0, 1]");
            }
        }

        DetectorConfig.AlertingSettings alerting = config.getAlerting();
        if (alerting != null && alerting.getCooldown() < 0) {
            violations.add("alerting.cooldown must be >= 0");
        }

        if (!violations.isEmpty()) {
            throw new ConfigurationException(config.getId() != null ? config.getId() : "<new detector>", violations);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
