package com.z254.sentinel.api.v1;

import com.z254.sentinel.alerting.AlertService;
import com.z254.sentinel.api.dto.SummaryResponse;
import com.z254.sentinel.detection.DetectorRegistry;
import com.z254.sentinel.domain.model.NotificationChannel;
import com.z254.sentinel.notification.NotificationDispatcher;
import com.z254.sentinel.scheduling.SentinelScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/**
 * Service-wide summary, provider health and loop control.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "System", description = "Summary, provider health and loop control")
public class SystemController {

    private final DetectorRegistry detectorRegistry;
    private final AlertService alertService;
    private final NotificationDispatcher dispatcher;
    private final SentinelScheduler scheduler;
    private final Clock clock;

    public SystemController(DetectorRegistry detectorRegistry,
                            AlertService alertService,
                            NotificationDispatcher dispatcher,
                            SentinelScheduler scheduler,
                            Clock clock) {
        this.detectorRegistry = detectorRegistry;
        this.alertService = alertService;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @GetMapping("/summary")
    @Operation(summary = "Get summary", description = "Anomaly and alert counts")
    public Mono<ResponseEntity<SummaryResponse>> getSummary() {
        return Mono.fromCallable(() -> ResponseEntity.ok(SummaryResponse.builder()
                .detection(detectorRegistry.getSummary())
                .alerts(alertService.getSummary())
                .loopsRunning(scheduler.isRunning())
                .generatedAt(clock.instant())
                .build()));
    }

    @GetMapping("/providers/health")
    @Operation(summary = "Provider health", description = "Health of every registered notification provider")
    public Mono<ResponseEntity<Map<NotificationChannel, Boolean>>> providerHealth() {
        return dispatcher.healthCheck().map(ResponseEntity::ok);
    }

    @PostMapping("/loops/stop")
    @Operation(summary = "Stop loops", description = "Halt training, detection, rule evaluation and escalation")
    public Mono<ResponseEntity<Map<String, Boolean>>> stopLoops() {
        scheduler.stop();
        return Mono.just(ResponseEntity.ok(Map.of("running", scheduler.isRunning())));
    }

    @PostMapping("/loops/start")
    @Operation(summary = "Start loops", description = "Resume the periodic loops")
    public Mono<ResponseEntity<Map<String, Boolean>>> startLoops() {
        scheduler.start();
        return Mono.just(ResponseEntity.ok(Map.of("running", scheduler.isRunning())));
    }
}
