package com.z254.sentinel.notification.provider;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.NotificationChannel;
import com.z254.sentinel.notification.AlertMessages;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts alerts to a Slack incoming webhook.
 */
@Slf4j
public class SlackNotificationProvider extends AbstractWebClientProvider {

    private final SentinelProperties.Notifications.Slack settings;

    public SlackNotificationProvider(WebClient.Builder webClientBuilder, SentinelProperties.Notifications.Slack settings) {
        super(NotificationChannel.SLACK, webClientBuilder);
        this.settings = settings;
    }

    @Override
    @CircuitBreaker(name = "slack-provider", fallbackMethod = "sendFallback")
    public Mono<Boolean> send(Alert alert, List<String> recipients) {
        if (isBlank(settings.getWebhookUrl())) {
            return notConfigured("webhook URL");
        }
        return postJson(settings.getWebhookUrl(), Map.of(), message(alert))
                .doOnSuccess(ok -> log.info("Slack notification sent: alertId={}, recipients={}", alert.getId(), recipients));
    }

    public Mono<Boolean> sendFallback(Alert alert, List<String> recipients, Throwable throwable) {
        return sendFailure(alert, throwable);
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.just(!isBlank(settings.getWebhookUrl()));
    }

    Map<String, Object> message(Alert alert) {
        List<Map<String, Object>> fields = List.of(
                field("Category", alert.getCategory(), true),
                field("Environment", AlertMessages.environment(alert), true),
                field("Metric", AlertMessages.metric(alert), true),
                field("Value", AlertMessages.value(alert), true),
                field("Threshold", AlertMessages.threshold(alert), true),
                field("Time", String.valueOf(alert.getTimestamp()), true),
                field("Description", alert.getDescription(), false));

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", AlertMessages.color(alert.getSeverity()));
        attachment.put("fields", fields);
        attachment.put("footer", "Alert ID: " + alert.getId());
        attachment.put("ts", alert.getTimestamp().getEpochSecond());

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("text", AlertMessages.emoji(alert.getSeverity()) + " *" + alert.getSeverity().name() + "*: " + alert.getTitle());
        message.put("attachments", List.of(attachment));
        return message;
    }

    private static Map<String, Object> field(String title, String value, boolean isShort) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value == null ? "" : value);
        field.put("short", isShort);
        return field;
    }
}
