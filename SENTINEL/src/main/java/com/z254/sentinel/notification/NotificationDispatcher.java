package com.z254.sentinel.notification;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.Notification;
import com.z254.sentinel.domain.model.NotificationChannel;
import com.z254.sentinel.domain.model.NotificationStatus;
import com.z254.sentinel.observability.SentinelMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Fans an alert out to its channels concurrently.
 * <p>
 * Every attempted channel yields exactly one {@link Notification}, {@code SENT} or {@code FAILED}
 * with the error. Each send is bounded by {@code sentinel.notifications.send-timeout}; the
 * returned {@link Mono} completes once every send has returned. Nothing is retried here.
 */
@Slf4j
@Component
public class NotificationDispatcher {

    private final Map<NotificationChannel, NotificationProvider> providers = new EnumMap<>(NotificationChannel.class);
    private final Duration sendTimeout;
    private final SentinelMetrics metrics;
    private final Clock clock;

    public NotificationDispatcher(List<NotificationProvider> providers,
                                  SentinelProperties properties,
                                  SentinelMetrics metrics,
                                  Clock clock) {
        providers.stream()
                .filter(p -> properties.getNotifications().isChannelEnabled(p.channel()))
                .forEach(p -> this.providers.put(p.channel(), p));
        this.sendTimeout = properties.getNotifications().getSendTimeout();
        this.metrics = metrics;
        this.clock = clock;
        log.info("Notification providers registered: {}", this.providers.keySet());
    }

    /**
     * Dispatch to {@code channels} with the per-channel recipients.
     *
     * @param level      escalation level recorded on the notifications
     * @param retryCount retry counter recorded on the notifications
     */
    public Mono<List<Notification>> dispatch(Alert alert,
                                             List<NotificationChannel> channels,
                                             Map<NotificationChannel, List<String>> recipients,
                                             int level,
                                             int retryCount) {
        if (channels == null || channels.isEmpty()) {
            return Mono.just(List.of());
        }
        Timer.Sample sample = metrics.startDispatchTimer();

        return Flux.fromIterable(channels)
                .distinct()
                .filter(channel -> isDeliverable(alert, channel, recipients))
                .flatMap(channel -> attempt(alert, channel, recipients.get(channel), level, retryCount))
                .collectList()
                .doOnNext(sent -> metrics.recordDispatchCompleted(sample));
    }

    public Optional<NotificationProvider> provider(NotificationChannel channel) {
        return Optional.ofNullable(providers.get(channel));
    }

    public Map<NotificationChannel, NotificationProvider> providers() {
        return Map.copyOf(providers);
    }

    /**
     * Health of every registered provider. A provider whose check errors or times out is unhealthy.
     */
    public Mono<Map<NotificationChannel, Boolean>> healthCheck() {
        return Flux.fromIterable(providers.values())
                .flatMap(provider -> Mono.defer(provider::healthCheck)
                        .timeout(sendTimeout)
                        .onErrorReturn(false)
                        .defaultIfEmpty(false)
                        .map(healthy -> Map.entry(provider.channel(), healthy)))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    // ========== Private Methods ==========

    private boolean isDeliverable(Alert alert, NotificationChannel channel,
                                  Map<NotificationChannel, List<String>> recipients) {
        if (!providers.containsKey(channel)) {
            log.warn("No provider registered for channel {}, skipping alert {}", channel, alert.getId());
            return false;
        }
        List<String> targets = recipients == null ? null : recipients.get(channel);
        if (targets == null || targets.isEmpty()) {
            log.warn("No recipients for channel {}, skipping alert {}", channel, alert.getId());
            return false;
        }
        return true;
    }

    private Mono<Notification> attempt(Alert alert, NotificationChannel channel, List<String> recipients,
                                       int level, int retryCount) {
        Instant sentAt = clock.instant();
        NotificationProvider provider = providers.get(channel);

        return Mono.defer(() -> provider.send(alert, recipients))
                .timeout(sendTimeout)
                .defaultIfEmpty(false)
                .map(ok -> ok
                        ? notification(channel, recipients, sentAt, level, retryCount, NotificationStatus.SENT, null)
                        : notification(channel, recipients, sentAt, level, retryCount, NotificationStatus.FAILED,
                                channel + " provider rejected the notification"))
                .onErrorResume(error -> Mono.just(notification(channel, recipients, sentAt, level, retryCount,
                        NotificationStatus.FAILED, describe(error))))
                .doOnNext(n -> {
                    metrics.recordNotification(channel, n.getStatus() == NotificationStatus.SENT);
                    if (n.getStatus() == NotificationStatus.FAILED) {
                        log.warn("Notification failed: alertId={}, channel={}, level={}, error={}",
                                alert.getId(), channel, level, n.getError());
                    }
                });
    }

    private String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "Timed out after " + sendTimeout.toMillis() + "ms";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static Notification notification(NotificationChannel channel, List<String> recipients, Instant sentAt,
                                             int level, int retryCount, NotificationStatus status, String error) {
        return Notification.builder()
                .id(UUID.randomUUID().toString())
                .channel(channel)
                .recipients(List.copyOf(recipients))
                .sentAt(sentAt)
                .status(status)
                .error(error)
                .escalationLevel(level)
                .retryCount(retryCount)
                .build();
    }
}
