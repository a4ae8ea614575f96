package com.z254.sentinel.api.dto;

import lombok.Data;

/**
 * Request body for suppressing an alert.
 */
@Data
public class SuppressRequest {
    private int durationMinutes;
    private String reason;
}
