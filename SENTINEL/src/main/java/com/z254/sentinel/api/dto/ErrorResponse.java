package com.z254.sentinel.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by every failed API call.
 */
@Data
@Builder
public class ErrorResponse {
    private int status;
    private String error;
    private String message;
    private List<String> violations;
    private Instant timestamp;
}
