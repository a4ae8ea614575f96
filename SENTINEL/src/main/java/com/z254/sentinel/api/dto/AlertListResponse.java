package com.z254.sentinel.api.dto;

import com.z254.sentinel.domain.model.Alert;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response DTO for alert list.
 */
@Data
@Builder
public class AlertListResponse {
    private List<Alert> alerts;
    private long total;
}
