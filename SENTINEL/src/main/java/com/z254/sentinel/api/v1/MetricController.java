package com.z254.sentinel.api.v1;

import com.z254.sentinel.api.dto.MetricSampleRequest;
import com.z254.sentinel.domain.model.MetricValue;
import com.z254.sentinel.metrics.InMemoryMetricSource;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API controller for pushing metric samples into the in-memory metric source.
 */
@RestController
@RequestMapping("/api/v1/metrics")
@Tag(name = "Metrics", description = "Metric ingestion")
public class MetricController {

    private final InMemoryMetricSource metricSource;

    public MetricController(InMemoryMetricSource metricSource) {
        this.metricSource = metricSource;
    }

    @PostMapping
    @Operation(summary = "Ingest samples", description = "Record a batch of metric samples")
    public Mono<ResponseEntity<Map<String, Integer>>> ingest(@RequestBody List<MetricSampleRequest> samples) {
        return Mono.fromCallable(() -> {
            for (MetricSampleRequest sample : samples) {
                if (sample.getMetric() == null || sample.getMetric().isBlank() || sample.getValue() == null) {
                    throw new IllegalArgumentException("metric and value are required for every sample");
                }
            }
            samples.forEach(sample -> {
                if (sample.getTimestamp() != null) {
                    metricSource.record(sample.getMetric(), sample.getValue(), sample.getTimestamp());
                } else {
                    metricSource.record(sample.getMetric(), sample.getValue());
                }
            });
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("accepted", samples.size()));
        });
    }

    @GetMapping
    @Operation(summary = "List metrics", description = "Names of all metrics with a recorded value")
    public Mono<ResponseEntity<Set<String>>> listMetrics() {
        return Mono.fromCallable(() -> ResponseEntity.ok(metricSource.metrics()));
    }

    @GetMapping("/{metric}")
    @Operation(summary = "Current value", description = "Latest recorded value of a metric")
    public Mono<ResponseEntity<MetricValue>> currentValue(
            @Parameter(description = "Metric name") @PathVariable String metric) {
        return Mono.fromCallable(() -> metricSource.getMetricValue(metric)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }
}
