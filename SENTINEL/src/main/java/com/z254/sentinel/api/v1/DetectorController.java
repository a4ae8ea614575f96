package com.z254.sentinel.api.v1;

import com.z254.sentinel.detection.DetectorInfo;
import com.z254.sentinel.detection.DetectorRegistry;
import com.z254.sentinel.detection.Forecast;
import com.z254.sentinel.domain.model.Anomaly;
import com.z254.sentinel.domain.model.DetectorConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * REST API controller for anomaly detectors.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/detectors")
@Tag(name = "Detectors", description = "Anomaly detector configuration, training and prediction")
public class DetectorController {

    private final DetectorRegistry detectorRegistry;

    public DetectorController(DetectorRegistry detectorRegistry) {
        this.detectorRegistry = detectorRegistry;
    }

    @GetMapping
    @Operation(summary = "List detectors", description = "List all configured detectors with their training state")
    public Mono<ResponseEntity<List<DetectorInfo>>> listDetectors() {
        return Mono.fromCallable(() -> ResponseEntity.ok(detectorRegistry.getDetectors()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get detector", description = "Get detector configuration and state by ID")
    public Mono<ResponseEntity<DetectorInfo>> getDetector(
            @Parameter(description = "Detector ID") @PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(detectorRegistry.getDetector(id)));
    }

    @PostMapping
    @Operation(summary = "Create detector", description = "Register a new anomaly detector")
    public Mono<ResponseEntity<DetectorInfo>> createDetector(@RequestBody DetectorConfig config) {
        log.info("Creating detector {} for metric {}", config.getId(), config.getMetric());
        return Mono.fromCallable(() -> ResponseEntity.status(HttpStatus.CREATED)
                .body(detectorRegistry.addDetector(config)));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update detector",
               description = "Replace a detector configuration; algorithm or sensitivity changes schedule a retrain")
    public Mono<ResponseEntity<DetectorInfo>> updateDetector(
            @Parameter(description = "Detector ID") @PathVariable String id,
            @RequestBody DetectorConfig config) {
        return Mono.fromCallable(() -> ResponseEntity.ok(detectorRegistry.updateDetector(id, config)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete detector", description = "Remove a detector and its anomaly log")
    public Mono<ResponseEntity<Void>> deleteDetector(
            @Parameter(description = "Detector ID") @PathVariable String id) {
        return Mono.fromRunnable(() -> detectorRegistry.removeDetector(id))
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }

    @PostMapping("/{id}/train")
    @Operation(summary = "Train detector", description = "Train a detector on its training window now")
    public Mono<ResponseEntity<DetectorInfo>> trainDetector(
            @Parameter(description = "Detector ID") @PathVariable String id) {
        return Mono.fromCallable(() -> {
                    detectorRegistry.trainDetector(id);
                    return ResponseEntity.ok(detectorRegistry.getDetector(id));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/detect")
    @Operation(summary = "Run detection", description = "Classify the metric's current value now")
    public Mono<ResponseEntity<Anomaly>> detect(
            @Parameter(description = "Detector ID") @PathVariable String id) {
        return Mono.fromCallable(() -> detectorRegistry.detect(id))
                .map(anomaly -> anomaly.map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.noContent().build()));
    }

    @GetMapping("/{id}/prediction")
    @Operation(summary = "Get prediction", description = "Forecast the detector's metric")
    public Mono<ResponseEntity<Forecast>> getPrediction(
            @Parameter(description = "Detector ID") @PathVariable String id,
            @Parameter(description = "Number of one-minute points, defaults to the configured horizon")
            @RequestParam(required = false) Integer horizon) {
        return Mono.fromCallable(() -> ResponseEntity.ok(detectorRegistry.getPrediction(id, horizon)));
    }
}
