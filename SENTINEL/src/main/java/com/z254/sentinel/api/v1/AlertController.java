package com.z254.sentinel.api.v1;

import com.z254.sentinel.alerting.AlertService;
import com.z254.sentinel.api.dto.AcknowledgeRequest;
import com.z254.sentinel.api.dto.AlertListResponse;
import com.z254.sentinel.api.dto.SuppressRequest;
import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.AlertFilter;
import com.z254.sentinel.domain.model.AlertStatus;
import com.z254.sentinel.domain.model.Severity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for alert lifecycle operations.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Alert querying and lifecycle")
public class AlertController {

    private final AlertService alertService;

    public AlertController(AlertService alertService) {
        this.alertService = alertService;
    }

    @GetMapping
    @Operation(summary = "List alerts", description = "List alerts with optional filters, newest first")
    public Mono<ResponseEntity<AlertListResponse>> listAlerts(
            @Parameter(description = "Filter by status")
            @RequestParam(required = false) AlertStatus status,
            @Parameter(description = "Filter by severity")
            @RequestParam(required = false) Severity severity,
            @Parameter(description = "Filter by category")
            @RequestParam(required = false) String category,
            @Parameter(description = "Filter by rule ID")
            @RequestParam(required = false) String ruleId) {

        return Mono.fromCallable(() -> {
            List<Alert> alerts = alertService.getAlerts(new AlertFilter(status, severity, category, ruleId));
            return ResponseEntity.ok(AlertListResponse.builder()
                    .alerts(alerts)
                    .total(alerts.size())
                    .build());
        });
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get alert", description = "Get alert details by ID")
    public Mono<ResponseEntity<Alert>> getAlert(
            @Parameter(description = "Alert ID") @PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(alertService.getAlert(id)));
    }

    @PostMapping("/{id}/acknowledge")
    @Operation(summary = "Acknowledge alert", description = "Acknowledge an open alert, stopping its escalation")
    public Mono<ResponseEntity<Alert>> acknowledge(
            @Parameter(description = "Alert ID") @PathVariable String id,
            @RequestBody AcknowledgeRequest request) {
        log.info("Acknowledging alert {} by {}", id, request.getAcknowledgedBy());
        return Mono.fromCallable(() -> ResponseEntity.ok(alertService.acknowledge(id, request.getAcknowledgedBy())));
    }

    @PostMapping("/{id}/resolve")
    @Operation(summary = "Resolve alert", description = "Mark an alert as resolved")
    public Mono<ResponseEntity<Alert>> resolve(
            @Parameter(description = "Alert ID") @PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(alertService.resolve(id)));
    }

    @PostMapping("/{id}/suppress")
    @Operation(summary = "Suppress alert", description = "Suppress an open alert for a number of minutes")
    public Mono<ResponseEntity<Alert>> suppress(
            @Parameter(description = "Alert ID") @PathVariable String id,
            @RequestBody SuppressRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                alertService.suppress(id, request.getDurationMinutes(), request.getReason())));
    }

    @PostMapping("/{id}/retry")
    @Operation(summary = "Retry notifications", description = "Re-send the alert's failed notifications")
    public Mono<ResponseEntity<Alert>> retryNotifications(
            @Parameter(description = "Alert ID") @PathVariable String id) {
        return Mono.defer(() -> alertService.retryFailedNotifications(id))
                .map(ResponseEntity::ok);
    }
}
