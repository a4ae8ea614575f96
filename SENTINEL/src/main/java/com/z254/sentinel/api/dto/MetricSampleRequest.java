package com.z254.sentinel.api.dto;

import com.z254.sentinel.domain.model.MetricValue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One metric observation pushed over HTTP or Kafka. A missing timestamp means "now".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricSampleRequest {
    private String metric;
    private MetricValue value;
    private Instant timestamp;
}
