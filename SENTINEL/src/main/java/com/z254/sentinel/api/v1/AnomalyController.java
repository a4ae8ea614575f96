package com.z254.sentinel.api.v1;

import com.z254.sentinel.api.dto.AnomalyListResponse;
import com.z254.sentinel.detection.DetectorRegistry;
import com.z254.sentinel.domain.model.Anomaly;
import com.z254.sentinel.domain.model.AnomalyAlgorithm;
import com.z254.sentinel.domain.model.AnomalyFilter;
import com.z254.sentinel.domain.model.Severity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * REST API controller for the anomaly log.
 */
@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Detected anomaly querying")
public class AnomalyController {

    private final DetectorRegistry detectorRegistry;

    public AnomalyController(DetectorRegistry detectorRegistry) {
        this.detectorRegistry = detectorRegistry;
    }

    @GetMapping
    @Operation(summary = "List anomalies", description = "List logged anomalies with optional filters, newest first")
    public Mono<ResponseEntity<AnomalyListResponse>> listAnomalies(
            @Parameter(description = "Filter by metric")
            @RequestParam(required = false) String metric,
            @Parameter(description = "Filter by severity")
            @RequestParam(required = false) Severity severity,
            @Parameter(description = "Filter by algorithm")
            @RequestParam(required = false) AnomalyAlgorithm algorithm,
            @Parameter(description = "Earliest timestamp, inclusive")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @Parameter(description = "Latest timestamp, inclusive")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @Parameter(description = "Maximum number of anomalies returned")
            @RequestParam(defaultValue = "100") int limit) {

        return Mono.fromCallable(() -> {
            List<Anomaly> matches = detectorRegistry.getAnomalies(
                    new AnomalyFilter(metric, severity, algorithm, from, to));
            return ResponseEntity.ok(AnomalyListResponse.builder()
                    .anomalies(matches.stream().limit(Math.max(0, limit)).toList())
                    .total(matches.size())
                    .build());
        });
    }
}
