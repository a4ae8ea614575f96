package com.z254.sentinel.kafka;

import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.Anomaly;

/**
 * Outbound event stream for anomalies and alert transitions. Publishing never fails the caller.
 */
public interface SentinelEventPublisher {

    void publishAnomaly(Anomaly anomaly);

    /**
     * @param transition e.g. {@code CREATED}, {@code ACKNOWLEDGED}, {@code ESCALATED}
     */
    void publishAlert(Alert alert, String transition);
}
