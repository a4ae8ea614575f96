package com.z254.sentinel.kafka;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.Anomaly;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Kafka producer for anomaly and alert events.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sentinel.kafka", name = "enabled", havingValue = "true")
public class KafkaEventPublisher implements SentinelEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final SentinelProperties sentinelProperties;
    private final Clock clock;

    public KafkaEventPublisher(KafkaTemplate<String, Object> kafkaTemplate,
                               SentinelProperties sentinelProperties,
                               Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.sentinelProperties = sentinelProperties;
        this.clock = clock;
    }

    @Override
    public void publishAnomaly(Anomaly anomaly) {
        String topic = sentinelProperties.getKafka().getTopics().getAnomalies();
        send(topic, new SentinelEvent(UUID.randomUUID().toString(), "ANOMALY_DETECTED",
                anomaly.getId(), clock.instant(), anomaly));
    }

    @Override
    public void publishAlert(Alert alert, String transition) {
        String topic = sentinelProperties.getKafka().getTopics().getAlerts();
        send(topic, new SentinelEvent(UUID.randomUUID().toString(), "ALERT_" + transition,
                alert.getId(), clock.instant(), alert));
    }

    private void send(String topic, SentinelEvent event) {
        try {
            kafkaTemplate.send(topic, event.entityId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to publish event: type={}, entityId={}, error={}",
                                    event.eventType(), event.entityId(), ex.getMessage());
                        } else {
                            log.debug("Published event: type={}, entityId={}, topic={}, partition={}",
                                    event.eventType(), event.entityId(), topic,
                                    result.getRecordMetadata().partition());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Failed to publish event: type={}, entityId={}, error={}",
                    event.eventType(), event.entityId(), e.getMessage());
        }
    }
}
