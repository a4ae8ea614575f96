package com.z254.sentinel.notification;

import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.NotificationChannel;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Delivery capability for one notification channel.
 * <p>
 * {@link #send} completes with {@code true} once the downstream system accepted the alert.
 * A failed hand-over either completes with {@code false} or errors; the dispatcher records
 * both as a failed notification.
 */
public interface NotificationProvider {

    NotificationChannel channel();

    Mono<Boolean> send(Alert alert, List<String> recipients);

    Mono<Boolean> healthCheck();
}
