package com.z254.sentinel.api.dto;

import com.z254.sentinel.alerting.AlertSummary;
import com.z254.sentinel.detection.DetectionSummary;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class SummaryResponse {
    private DetectionSummary detection;
    private AlertSummary alerts;
    private boolean loopsRunning;
    private Instant generatedAt;
}
