package com.z254.sentinel.kafka;

import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.Anomaly;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Publisher used while Kafka is disabled; events only reach the debug log.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sentinel.kafka", name = "enabled", havingValue = "false", matchIfMissing = true)
public class LoggingEventPublisher implements SentinelEventPublisher {

    @Override
    public void publishAnomaly(Anomaly anomaly) {
        log.debug("Anomaly event (kafka disabled): id={}, metric={}", anomaly.getId(), anomaly.getMetric());
    }

    @Override
    public void publishAlert(Alert alert, String transition) {
        log.debug("Alert event (kafka disabled): id={}, transition={}", alert.getId(), transition);
    }
}
