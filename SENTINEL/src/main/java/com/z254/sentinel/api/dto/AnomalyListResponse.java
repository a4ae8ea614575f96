package com.z254.sentinel.api.dto;

import com.z254.sentinel.domain.model.Anomaly;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response DTO for anomaly list. {@code total} counts all matches before the limit is applied.
 */
@Data
@Builder
public class AnomalyListResponse {
    private List<Anomaly> anomalies;
    private long total;
}
