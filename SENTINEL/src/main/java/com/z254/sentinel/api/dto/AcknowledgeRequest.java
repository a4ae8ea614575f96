package com.z254.sentinel.api.dto;

import lombok.Data;

/**
 * Request body for acknowledging an alert.
 */
@Data
public class AcknowledgeRequest {
    private String acknowledgedBy;
}
