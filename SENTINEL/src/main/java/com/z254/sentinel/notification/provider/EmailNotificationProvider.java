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
 * Sends alert emails through an HTTP mail relay speaking the SendGrid v3 {@code mail/send} format.
 */
@Slf4j
public class EmailNotificationProvider extends AbstractWebClientProvider {

    private final SentinelProperties.Notifications.Email settings;

    public EmailNotificationProvider(WebClient.Builder webClientBuilder, SentinelProperties.Notifications.Email settings) {
        super(NotificationChannel.EMAIL, webClientBuilder);
        this.settings = settings;
    }

    @Override
    @CircuitBreaker(name = "email-provider", fallbackMethod = "sendFallback")
    public Mono<Boolean> send(Alert alert, List<String> recipients) {
        if (isBlank(settings.getRelayUrl())) {
            return notConfigured("relay URL");
        }
        Map<String, String> headers = isBlank(settings.getApiKey())
                ? Map.of()
                : Map.of("Authorization", "Bearer " + settings.getApiKey());

        return postJson(settings.getRelayUrl(), headers, mail(alert, recipients))
                .doOnSuccess(ok -> log.info("Email notification sent: alertId={}, recipients={}", alert.getId(), recipients));
    }

    public Mono<Boolean> sendFallback(Alert alert, List<String> recipients, Throwable throwable) {
        return sendFailure(alert, throwable);
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.just(!isBlank(settings.getRelayUrl()));
    }

    Map<String, Object> mail(Alert alert, List<String> recipients) {
        Map<String, Object> mail = new LinkedHashMap<>();
        mail.put("personalizations", List.of(Map.of("to",
                recipients.stream().map(r -> Map.of("email", r)).toList())));
        mail.put("from", Map.of("email", settings.getFrom()));
        mail.put("subject", AlertMessages.headline(alert));
        mail.put("content", List.of(Map.of("type", "text/html", "value", html(alert))));
        return mail;
    }

    private static String html(Alert alert) {
        return "<h2>" + alert.getTitle() + "</h2>"
                + "<p><strong>Severity:</strong> " + alert.getSeverity().name() + "</p>"
                + "<p><strong>Category:</strong> " + alert.getCategory() + "</p>"
                + "<p><strong>Description:</strong> " + alert.getDescription() + "</p>"
                + "<p><strong>Time:</strong> " + alert.getTimestamp() + "</p>"
                + "<p><strong>Metric:</strong> " + AlertMessages.metric(alert) + "</p>"
                + "<p><strong>Value:</strong> " + AlertMessages.value(alert) + "</p>"
                + "<p><strong>Threshold:</strong> " + AlertMessages.threshold(alert) + "</p>"
                + "<p><strong>Environment:</strong> " + AlertMessages.environment(alert) + "</p>"
                + "<hr><p><em>Alert ID: " + alert.getId() + "</em></p>";
    }
}
