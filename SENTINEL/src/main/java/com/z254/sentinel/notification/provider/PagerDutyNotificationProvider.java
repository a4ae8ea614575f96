package com.z254.sentinel.notification.provider;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.NotificationChannel;
import com.z254.sentinel.domain.model.Severity;
import com.z254.sentinel.notification.AlertMessages;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Triggers PagerDuty incidents through the Events API v2. The alert id is the dedup key,
 * so escalation repeats update one incident instead of opening new ones.
 */
@Slf4j
public class PagerDutyNotificationProvider extends AbstractWebClientProvider {

    private final SentinelProperties.Notifications.PagerDuty settings;

    public PagerDutyNotificationProvider(WebClient.Builder webClientBuilder,
                                         SentinelProperties.Notifications.PagerDuty settings) {
        super(NotificationChannel.PAGERDUTY, webClientBuilder);
        this.settings = settings;
    }

    @Override
    @CircuitBreaker(name = "pagerduty-provider", fallbackMethod = "sendFallback")
    public Mono<Boolean> send(Alert alert, List<String> recipients) {
        if (isBlank(settings.getApiKey()) || isBlank(settings.getRoutingKey())) {
            return notConfigured("API key or routing key");
        }
        return postJson(settings.getEventsUrl(),
                Map.of("Authorization", "Token token=" + settings.getApiKey()),
                event(alert))
                .doOnSuccess(ok -> log.info("PagerDuty notification sent: alertId={}, dedupKey={}", alert.getId(), alert.getId()));
    }

    public Mono<Boolean> sendFallback(Alert alert, List<String> recipients, Throwable throwable) {
        return sendFailure(alert, throwable);
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.just(!isBlank(settings.getApiKey()) && !isBlank(settings.getRoutingKey()));
    }

    Map<String, Object> event(Alert alert) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("description", alert.getDescription());
        details.put("category", alert.getCategory());
        details.put("metric", AlertMessages.metric(alert));
        details.put("value", AlertMessages.value(alert));
        details.put("threshold", AlertMessages.threshold(alert));
        details.put("environment", AlertMessages.environment(alert));
        details.put("tags", alert.getContext() != null ? alert.getContext().getTags() : Map.of());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("summary", alert.getTitle());
        payload.put("severity", pagerDutySeverity(alert.getSeverity()));
        payload.put("source", alert.getContext() != null ? alert.getContext().getSource() : "sentinel");
        payload.put("timestamp", alert.getTimestamp().toString());
        payload.put("custom_details", details);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("routing_key", settings.getRoutingKey());
        event.put("event_action", "trigger");
        event.put("dedup_key", alert.getId());
        event.put("payload", payload);
        return event;
    }

    /**
     * Events API v2 accepts critical, error, warning and info.
     */
    private static String pagerDutySeverity(Severity severity) {
        return switch (severity) {
            case CRITICAL -> "critical";
            case HIGH -> "error";
            case MEDIUM -> "warning";
            case LOW -> "info";
        };
    }
}
