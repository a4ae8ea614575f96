package com.z254.sentinel.alerting;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.*;
import com.z254.sentinel.domain.repository.AlertRepository;
import com.z254.sentinel.exception.AlertTransitionException;
import com.z254.sentinel.exception.NotFoundException;
import com.z254.sentinel.kafka.SentinelEventPublisher;
import com.z254.sentinel.notification.NotificationDispatcher;
import com.z254.sentinel.observability.SentinelMetrics;
import com.z254.sentinel.observability.SentinelStructuredLogger;
import com.z254.sentinel.observability.SentinelStructuredLogger.AlertEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Alert store and lifecycle.
 * <p>
 * Status transitions: {@code OPEN -> ACKNOWLEDGED | RESOLVED | SUPPRESSED},
 * {@code ACKNOWLEDGED -> RESOLVED} and {@code SUPPRESSED -> RESOLVED}. Every transition happens
 * under the alert's monitor, so the escalation scheduler always sees a fresh status.
 */
@Slf4j
@Service
public class AlertService {

    public static final String DETECTOR_CATEGORY = "anomaly";

    private final AlertRepository alertRepository;
    private final NotificationDispatcher dispatcher;
    private final SentinelEventPublisher eventPublisher;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final SentinelProperties properties;
    private final Clock clock;

    public AlertService(AlertRepository alertRepository,
                        NotificationDispatcher dispatcher,
                        SentinelEventPublisher eventPublisher,
                        SentinelMetrics metrics,
                        SentinelStructuredLogger structuredLogger,
                        SentinelProperties properties,
                        Clock clock) {
        this.alertRepository = alertRepository;
        this.dispatcher = dispatcher;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.properties = properties;
        this.clock = clock;
    }

    // ========== Creation ==========

    /**
     * Raise an alert for a fired rule and notify the rule's base channels. When a suppression rule
     * is active the alert is stored as {@code SUPPRESSED} and nothing is sent.
     */
    public Alert createRuleAlert(AlertRule rule, MetricValue value, AlertRule.SuppressionRule suppression) {
        Instant now = clock.instant();
        Alert alert = Alert.builder()
                .id(newAlertId())
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .severity(rule.getSeverity())
                .status(AlertStatus.OPEN)
                .category(rule.getCategory())
                .title(rule.getName())
                .description(rule.getDescription())
                .timestamp(now)
                .escalationLevel(0)
                .metadata(new HashMap<>(rule.getMetadata() != null ? rule.getMetadata() : Map.of()))
                .context(Alert.Context.builder()
                        .metric(rule.getCondition().getMetric())
                        .value(value)
                        .threshold(rule.getCondition().getThreshold())
                        .tags(new HashMap<>(rule.getCondition().getTags() != null ? rule.getCondition().getTags() : Map.of()))
                        .source(properties.getSource())
                        .environment(properties.getEnvironment())
                        .build())
                .build();

        if (suppression != null) {
            alert.setStatus(AlertStatus.SUPPRESSED);
            alert.setSuppressedUntil(now.plus(Duration.ofMinutes(suppression.getDuration())));
            alert.setSuppressionReason(suppression.getReason() != null ? suppression.getReason() : suppression.getName());
            alertRepository.save(alert);
            metrics.recordAlertSuppressed();
            structuredLogger.logAlertEvent(alert.getId(), rule.getId(), AlertEventType.SUPPRESSED,
                    "Alert suppressed by rule " + suppression.getId(),
                    Map.of("until", alert.getSuppressedUntil().toString()));
            eventPublisher.publishAlert(alert, "SUPPRESSED");
            return alert;
        }

        alertRepository.save(alert);
        metrics.recordAlertCreated();
        structuredLogger.logAlertEvent(alert.getId(), rule.getId(), AlertEventType.CREATED, "Alert triggered",
                details(alert));
        eventPublisher.publishAlert(alert, "CREATED");

        sendInBackground(alert, rule.getChannels(), rule.getRecipients(), 0);
        return alert;
    }

    /**
     * Raise an alert for a detected anomaly and notify the detector's channels.
     */
    public Alert createDetectorAlert(DetectorConfig config, Anomaly anomaly) {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("detectorId", config.getId());
        metadata.put("algorithm", anomaly.getAlgorithm().name());

        Alert alert = Alert.builder()
                .id(newAlertId())
                .ruleName(config.getName())
                .severity(anomaly.getSeverity())
                .status(AlertStatus.OPEN)
                .category(DETECTOR_CATEGORY)
                .title("Anomaly Detected: " + config.getName())
                .description(describe(anomaly))
                .timestamp(clock.instant())
                .escalationLevel(0)
                .anomalyId(anomaly.getId())
                .metadata(metadata)
                .context(Alert.Context.builder()
                        .metric(anomaly.getMetric())
                        .value(MetricValue.of(anomaly.getValue()))
                        .threshold(MetricValue.of(anomaly.getExpectedValue()))
                        .tags(new HashMap<>(config.getTags() != null ? config.getTags() : Map.of()))
                        .source(properties.getSource())
                        .environment(properties.getEnvironment())
                        .build())
                .build();

        alertRepository.save(alert);
        metrics.recordAlertCreated();
        structuredLogger.logAlertEvent(alert.getId(), null, AlertEventType.CREATED, alert.getTitle(), details(alert));
        eventPublisher.publishAlert(alert, "CREATED");

        DetectorConfig.AlertingSettings alerting = config.getAlerting();
        sendInBackground(alert, alerting.getChannels(), alerting.getRecipients(), 0);
        return alert;
    }

    // ========== Lifecycle ==========

    public Alert acknowledge(String alertId, String acknowledgedBy) {
        Alert alert = getAlert(alertId);
        synchronized (alert) {
            if (alert.getStatus() != AlertStatus.OPEN) {
                throw new AlertTransitionException(alertId, alert.getStatus(), AlertStatus.ACKNOWLEDGED);
            }
            alert.setStatus(AlertStatus.ACKNOWLEDGED);
            alert.setAcknowledgedAt(clock.instant());
            alert.setAcknowledgedBy(acknowledgedBy);
        }
        metrics.recordAlertAcknowledged();
        structuredLogger.logAlertEvent(alertId, alert.getRuleId(), AlertEventType.ACKNOWLEDGED, "Alert acknowledged",
                Map.of("acknowledgedBy", String.valueOf(acknowledgedBy), "level", alert.getEscalationLevel()));
        eventPublisher.publishAlert(alert, "ACKNOWLEDGED");
        return alert;
    }

    public Alert resolve(String alertId) {
        Alert alert = getAlert(alertId);
        synchronized (alert) {
            if (alert.getStatus() == AlertStatus.RESOLVED) {
                throw new AlertTransitionException(alertId, alert.getStatus(), AlertStatus.RESOLVED);
            }
            alert.setStatus(AlertStatus.RESOLVED);
            alert.setResolvedAt(clock.instant());
        }
        metrics.recordAlertResolved();
        structuredLogger.logAlertEvent(alertId, alert.getRuleId(), AlertEventType.RESOLVED, "Alert resolved", null);
        eventPublisher.publishAlert(alert, "RESOLVED");
        return alert;
    }

    public Alert suppress(String alertId, int durationMinutes, String reason) {
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("Suppression duration must be > 0 minutes");
        }
        Alert alert = getAlert(alertId);
        synchronized (alert) {
            if (alert.getStatus() != AlertStatus.OPEN) {
                throw new AlertTransitionException(alertId, alert.getStatus(), AlertStatus.SUPPRESSED);
            }
            alert.setStatus(AlertStatus.SUPPRESSED);
            alert.setSuppressedUntil(clock.instant().plus(Duration.ofMinutes(durationMinutes)));
            alert.setSuppressionReason(reason);
        }
        metrics.recordAlertSuppressed();
        structuredLogger.logAlertEvent(alertId, alert.getRuleId(), AlertEventType.SUPPRESSED, "Alert suppressed",
                Map.of("durationMinutes", durationMinutes, "reason", String.valueOf(reason)));
        eventPublisher.publishAlert(alert, "SUPPRESSED");
        return alert;
    }

    /**
     * Re-send every channel whose latest attempt failed, at the level and recipients of that attempt
     * and with {@code retryCount + 1}. Only open or acknowledged alerts are retried.
     */
    public Mono<Alert> retryFailedNotifications(String alertId) {
        Alert alert = getAlert(alertId);
        List<Notification> failed;
        synchronized (alert) {
            if (alert.getStatus() == AlertStatus.RESOLVED || alert.getStatus() == AlertStatus.SUPPRESSED) {
                throw new AlertTransitionException(alertId, alert.getStatus(), alert.getStatus());
            }
            failed = latestFailedPerChannel(alert);
        }
        if (failed.isEmpty()) {
            return Mono.just(alert);
        }

        return Flux.fromIterable(failed)
                .flatMap(previous -> dispatcher.dispatch(alert,
                        List.of(previous.getChannel()),
                        Map.of(previous.getChannel(), previous.getRecipients()),
                        previous.getEscalationLevel(),
                        previous.getRetryCount() + 1))
                .collectList()
                .map(batches -> {
                    List<Notification> sent = batches.stream().flatMap(List::stream).toList();
                    synchronized (alert) {
                        alert.addNotifications(sent);
                    }
                    structuredLogger.logAlertEvent(alertId, alert.getRuleId(), AlertEventType.RETRIED,
                            "Retried failed notifications", Map.of("attempts", sent.size()));
                    return alert;
                });
    }

    // ========== Notification Bookkeeping ==========

    /**
     * Dispatch and attach the results to the alert, unless the alert left {@code OPEN} meanwhile.
     */
    public Mono<List<Notification>> notify(Alert alert,
                                           List<NotificationChannel> channels,
                                           Map<NotificationChannel, List<String>> recipients,
                                           int level) {
        return dispatcher.dispatch(alert, channels, recipients, level, 0)
                .map(sent -> {
                    recordIfOpen(alert, sent);
                    return sent;
                });
    }

    void recordIfOpen(Alert alert, List<Notification> sent) {
        if (sent.isEmpty()) {
            return;
        }
        synchronized (alert) {
            if (!alert.isOpen()) {
                log.info("Discarding {} notification results for alert {} in status {}",
                        sent.size(), alert.getId(), alert.getStatus());
                return;
            }
            alert.addNotifications(sent);
        }
        sent.stream()
                .filter(n -> n.getStatus() == NotificationStatus.FAILED)
                .forEach(n -> structuredLogger.logAlertEvent(alert.getId(), alert.getRuleId(),
                        AlertEventType.NOTIFICATION_FAILED, "Notification failed",
                        Map.of("channel", n.getChannel().name(), "error", String.valueOf(n.getError()))));
    }

    /**
     * Drop resolved alerts older than {@code sentinel.rules.resolved-alert-retention}.
     *
     * @return number of alerts evicted
     */
    public int evictResolved() {
        Instant cutoff = clock.instant().minus(properties.getRules().getResolvedAlertRetention());
        int evicted = alertRepository.deleteResolvedBefore(cutoff);
        if (evicted > 0) {
            log.info("Evicted {} resolved alerts older than {}", evicted, cutoff);
        }
        return evicted;
    }

    // ========== Queries ==========

    public Alert getAlert(String alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new NotFoundException("Alert", alertId));
    }

    public List<Alert> getAlerts(AlertFilter filter) {
        return alertRepository.find(filter);
    }

    public List<Alert> getOpenAlerts() {
        return alertRepository.find(new AlertFilter(AlertStatus.OPEN, null, null, null));
    }

    public AlertSummary getSummary() {
        List<Alert> alerts = alertRepository.findAll();
        Instant recentSince = clock.instant().minus(properties.getDetection().getSummaryWindow());

        Map<AlertStatus, Long> byStatus = alerts.stream()
                .collect(Collectors.groupingBy(Alert::getStatus, () -> new EnumMap<>(AlertStatus.class), Collectors.counting()));
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, alerts.stream().filter(a -> a.getSeverity() == severity).count());
        }

        return new AlertSummary(
                alerts.size(),
                byStatus.getOrDefault(AlertStatus.OPEN, 0L),
                byStatus.getOrDefault(AlertStatus.ACKNOWLEDGED, 0L),
                byStatus.getOrDefault(AlertStatus.RESOLVED, 0L),
                byStatus.getOrDefault(AlertStatus.SUPPRESSED, 0L),
                alerts.stream().filter(a -> !a.getTimestamp().isBefore(recentSince)).count(),
                bySeverity);
    }

    // ========== Private Methods ==========

    private void sendInBackground(Alert alert, List<NotificationChannel> channels,
                                  Map<NotificationChannel, List<String>> recipients, int level) {
        notify(alert, channels, recipients, level)
                .subscribe(
                        sent -> log.debug("Initial notifications for alert {}: {}", alert.getId(), sent.size()),
                        error -> log.error("Dispatch failed for alert {}: {}", alert.getId(), error.getMessage(), error));
    }

    private static List<Notification> latestFailedPerChannel(Alert alert) {
        Map<NotificationChannel, Notification> latest = new EnumMap<>(NotificationChannel.class);
        for (Notification n : alert.getNotifications()) {
            Notification current = latest.get(n.getChannel());
            if (current == null || !n.getSentAt().isBefore(current.getSentAt())) {
                latest.put(n.getChannel(), n);
            }
        }
        return latest.values().stream()
                .filter(n -> n.getStatus() == NotificationStatus.FAILED)
                .toList();
    }

    private static Map<String, Object> details(Alert alert) {
        Map<String, Object> details = new HashMap<>();
        details.put("severity", alert.getSeverity().name());
        details.put("category", alert.getCategory());
        if (alert.getContext() != null) {
            details.put("metric", alert.getContext().getMetric());
            details.put("value", alert.getContext().getValue() != null ? alert.getContext().getValue().asText() : null);
            details.put("threshold", alert.getContext().getThreshold() != null ? alert.getContext().getThreshold().asText() : null);
        }
        return details;
    }

    private static String describe(Anomaly anomaly) {
        StringBuilder sb = new StringBuilder()
                .append("Metric: ").append(anomaly.getMetric()).append('\n')
                .append("Severity: ").append(anomaly.getSeverity()).append('\n')
                .append(String.format(Locale.ROOT, "Current Value: %.2f%n", anomaly.getValue()))
                .append(String.format(Locale.ROOT, "Expected Value: %.2f%n", anomaly.getExpectedValue()))
                .append(String.format(Locale.ROOT, "Anomaly Score: %.3f%n", anomaly.getScore()))
                .append(String.format(Locale.ROOT, "Confidence: %.1f%%%n", anomaly.getConfidence() * 100))
                .append("Algorithm: ").append(anomaly.getAlgorithm());
        if (anomaly.getRecommendations() != null && !anomaly.getRecommendations().isEmpty()) {
            sb.append("\n\n").append(String.join("\n", anomaly.getRecommendations()));
        }
        return sb.toString();
    }

    private static String newAlertId() {
        return "alert-" + UUID.randomUUID();
    }
}
