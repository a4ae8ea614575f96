package com.z254.sentinel.health;

import com.z254.sentinel.domain.model.NotificationChannel;
import com.z254.sentinel.notification.NotificationDispatcher;
import com.z254.sentinel.scheduling.SentinelScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for SENTINEL service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Notification provider health (DOWN when no provider is healthy)</li>
 *     <li>Loop state and the last failure of each loop</li>
 * </ul>
 */
@Slf4j
@Component
public class SentinelHealthIndicator implements ReactiveHealthIndicator {

    private final NotificationDispatcher dispatcher;
    private final SentinelScheduler scheduler;

    public SentinelHealthIndicator(NotificationDispatcher dispatcher, SentinelScheduler scheduler) {
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
    }

    @Override
    public Mono<Health> health() {
        return dispatcher.healthCheck()
                .map(this::checkHealth)
                .onErrorResume(e -> {
                    log.error("Health check failed for notification providers", e);
                    return Mono.just(Health.down()
                            .withDetail("providers.error", String.valueOf(e.getMessage()))
                            .build());
                });
    }

    private Health checkHealth(Map<NotificationChannel, Boolean> providers) {
        Map<String, Object> details = new HashMap<>();
        providers.forEach((channel, healthy) -> details.put("providers." + channel.name().toLowerCase(), healthy ? "UP" : "DOWN"));

        details.put("loops.running", scheduler.isRunning());
        scheduler.statuses().forEach((loop, status) -> {
            String key = "loops." + loop.name().toLowerCase();
            details.put(key + ".lastRunAt", status.lastRunAt() != null ? status.lastRunAt().toString() : "never");
            if (status.lastError() != null) {
                details.put(key + ".lastError", status.lastError());
            }
        });

        boolean anyProviderHealthy = providers.values().stream().anyMatch(Boolean::booleanValue);
        if (!anyProviderHealthy) {
            details.put("providers.error", "No healthy notification provider");
            return Health.down().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }
}
