package com.z254.sentinel.detection;

import com.z254.sentinel.domain.model.Anomaly;
import com.z254.sentinel.domain.model.AnomalyAlgorithm;
import com.z254.sentinel.domain.model.MetricSample;

import java.util.Optional;

/**
 * A trained, immutable anomaly classifier for one detector.
 * <p>
 * Returned anomalies carry no id; the registry assigns one when it logs them.
 */
public interface AnomalyDetector {

    AnomalyAlgorithm algorithm();

    /** Number of samples the detector was trained on */
    int sampleCount();

    Optional<Anomaly> detect(MetricSample sample);
}
