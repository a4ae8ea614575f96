package com.z254.sentinel.api.v1;

import com.z254.sentinel.api.dto.ErrorResponse;
import com.z254.sentinel.exception.AlertTransitionException;
import com.z254.sentinel.exception.ConfigurationException;
import com.z254.sentinel.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

/**
 * Maps service exceptions to HTTP responses for all v1 controllers.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException e) {
        log.warn("Rejected configuration for {}: {}", e.getEntityId(), e.getViolations());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), e.getViolations());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), List.of());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), List.of());
    }

    @ExceptionHandler(AlertTransitionException.class)
    public ResponseEntity<ErrorResponse> handleTransition(AlertTransitionException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage(), List.of());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, List<String> violations) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .violations(violations)
                .timestamp(Instant.now())
                .build());
    }
}
