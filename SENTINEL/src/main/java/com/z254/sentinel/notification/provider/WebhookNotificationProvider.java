package com.z254.sentinel.notification.provider;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.NotificationChannel;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts the full alert document to a generic webhook.
 */
@Slf4j
public class WebhookNotificationProvider extends AbstractWebClientProvider {

    private final SentinelProperties.Notifications.Webhook settings;
    private final String source;
    private final Clock clock;

    public WebhookNotificationProvider(WebClient.Builder webClientBuilder,
                                       SentinelProperties.Notifications.Webhook settings,
                                       String source,
                                       Clock clock) {
        super(NotificationChannel.WEBHOOK, webClientBuilder);
        this.settings = settings;
        this.source = source;
        this.clock = clock;
    }

    @Override
    @CircuitBreaker(name = "webhook-provider", fallbackMethod = "sendFallback")
    public Mono<Boolean> send(Alert alert, List<String> recipients) {
        if (isBlank(settings.getUrl())) {
            return notConfigured("URL");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alert", alert);
        payload.put("recipients", recipients);
        payload.put("timestamp", clock.instant().toString());
        payload.put("service", source);
        payload.put("environment", alert.getContext() != null ? alert.getContext().getEnvironment() : null);

        return postJson(settings.getUrl(), Map.of(), payload)
                .doOnSuccess(ok -> log.info("Webhook notification sent: alertId={}, url={}", alert.getId(), settings.getUrl()));
    }

    public Mono<Boolean> sendFallback(Alert alert, List<String> recipients, Throwable throwable) {
        return sendFailure(alert, throwable);
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.just(!isBlank(settings.getUrl()));
    }
}
