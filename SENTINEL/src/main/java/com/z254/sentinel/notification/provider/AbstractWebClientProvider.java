package com.z254.sentinel.notification.provider;

import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.NotificationChannel;
import com.z254.sentinel.exception.DispatchException;
import com.z254.sentinel.notification.NotificationProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Base for providers that hand alerts to an HTTP endpoint as JSON.
 * <p>
 * Subclasses annotate their {@code send} with a circuit breaker and route the fallback
 * through {@link #sendFailure}.
 */
@Slf4j
public abstract class AbstractWebClientProvider implements NotificationProvider {

    protected final WebClient webClient;
    private final NotificationChannel channel;

    protected AbstractWebClientProvider(NotificationChannel channel, WebClient.Builder webClientBuilder) {
        this.channel = channel;
        this.webClient = webClientBuilder.build();
    }

    @Override
    public NotificationChannel channel() {
        return channel;
    }

    /**
     * POST {@code body} as JSON. Completes with {@code true} on a 2xx response and errors with a
     * {@link DispatchException} otherwise.
     */
    protected Mono<Boolean> postJson(String url, Map<String, String> headers, Object body) {
        return webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> headers.forEach(h::set))
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .map(response -> response.getStatusCode().is2xxSuccessful())
                .onErrorMap(WebClientResponseException.class, e -> new DispatchException(channel,
                        channel + " API error: " + e.getStatusCode().value() + " " + e.getStatusText(), e))
                .onErrorMap(WebClientRequestException.class, e -> new DispatchException(channel,
                        channel + " unreachable: " + e.getMessage(), e));
    }

    protected Mono<Boolean> notConfigured(String setting) {
        return Mono.error(new DispatchException(channel, channel + " " + setting + " not configured"));
    }

    /**
     * Fallback path shared by the circuit breakers of all providers.
     */
    protected Mono<Boolean> sendFailure(Alert alert, Throwable throwable) {
        log.warn("{} notification failed for alert {}: {}", channel, alert.getId(), throwable.getMessage());
        if (throwable instanceof DispatchException dispatchException) {
            return Mono.error(dispatchException);
        }
        return Mono.error(new DispatchException(channel, channel + " unavailable: " + throwable.getMessage(), throwable));
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
