package com.z254.sentinel.kafka;

import com.z254.sentinel.api.dto.MetricSampleRequest;
import com.z254.sentinel.metrics.InMemoryMetricSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Feeds metric samples published on the input topic into the metric source.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sentinel.kafka", name = "enabled", havingValue = "true")
public class MetricSampleListener {

    private final InMemoryMetricSource metricSource;

    public MetricSampleListener(InMemoryMetricSource metricSource) {
        this.metricSource = metricSource;
    }

    @KafkaListener(
            topics = "${sentinel.kafka.topics.metrics-input}",
            groupId = "${spring.kafka.consumer.group-id:sentinel}",
            containerFactory = "kafkaListenerContainerFactory")
    public void onSample(MetricSampleRequest sample, Acknowledgment acknowledgment) {
        try {
            if (sample == null || sample.getMetric() == null || sample.getValue() == null) {
                log.warn("Dropping malformed metric sample: {}", sample);
            } else if (sample.getTimestamp() != null) {
                metricSource.record(sample.getMetric(), sample.getValue(), sample.getTimestamp());
            } else {
                metricSource.record(sample.getMetric(), sample.getValue());
            }
        } finally {
            acknowledgment.acknowledge();
        }
    }
}
