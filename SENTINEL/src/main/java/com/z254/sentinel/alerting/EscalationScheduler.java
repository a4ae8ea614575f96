package com.z254.sentinel.alerting;

import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.AlertRule;
import com.z254.sentinel.domain.model.EscalationLevel;
import com.z254.sentinel.domain.model.EscalationPolicy;
import com.z254.sentinel.domain.model.Notification;
import com.z254.sentinel.kafka.SentinelEventPublisher;
import com.z254.sentinel.observability.SentinelMetrics;
import com.z254.sentinel.observability.SentinelStructuredLogger;
import com.z254.sentinel.observability.SentinelStructuredLogger.AlertEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Moves open alerts up their rule's escalation policy.
 * <p>
 * The next step is decided and reserved while holding the alert's monitor, right after a fresh
 * status read, so an acknowledge that wins the race stops the escalation. Notifications for the
 * new level are sent after the monitor is released.
 */
@Slf4j
@Component
public class EscalationScheduler {

    private final AlertService alertService;
    private final RuleEngine ruleEngine;
    private final SentinelEventPublisher eventPublisher;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final Clock clock;

    public EscalationScheduler(AlertService alertService,
                               RuleEngine ruleEngine,
                               SentinelEventPublisher eventPublisher,
                               SentinelMetrics metrics,
                               SentinelStructuredLogger structuredLogger,
                               Clock clock) {
        this.alertService = alertService;
        this.ruleEngine = ruleEngine;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Kind of step taken for an alert on one tick.
     */
    public enum Step {
        NONE, ESCALATED, REPEATED
    }

    /**
     * Run one escalation pass over every open alert and wait for the resulting dispatches.
     * Resolved alerts past their retention are evicted first.
     *
     * @return number of alerts that escalated or repeated
     */
    public int escalateAll() {
        alertService.evictResolved();
        Integer stepped = Flux.fromIterable(alertService.getOpenAlerts())
                .flatMap(alert -> escalate(alert)
                        .onErrorResume(e -> {
                            log.error("Escalation failed for alert {}", alert.getId(), e);
                            return Mono.just(Step.NONE);
                        }))
                .filter(step -> step != Step.NONE)
                .count()
                .map(Long::intValue)
                .block();
        return stepped != null ? stepped : 0;
    }

    /**
     * Escalate or repeat one alert when its policy says it is due.
     */
    public Mono<Step> escalate(Alert alert) {
        Optional<EscalationPolicy> policy = policyOf(alert);
        if (policy.isEmpty()) {
            return Mono.just(Step.NONE);
        }

        Instant now = clock.instant();
        Planned planned;
        synchronized (alert) {
            if (!alert.isOpen()) {
                return Mono.just(Step.NONE);
            }
            planned = plan(alert, policy.get(), now);
            if (planned == null) {
                return Mono.just(Step.NONE);
            }
            if (planned.step() == Step.ESCALATED) {
                alert.setEscalationLevel(planned.level().getLevel());
                alert.setEscalatedAt(now);
                alert.setRepeatCount(0);
            } else {
                alert.setRepeatCount(alert.getRepeatCount() + 1);
            }
        }

        EscalationLevel level = planned.level();
        if (planned.step() == Step.ESCALATED) {
            metrics.recordAlertEscalated();
            structuredLogger.logAlertEvent(alert.getId(), alert.getRuleId(), AlertEventType.ESCALATED,
                    "Alert escalated to level " + level.getLevel(),
                    Map.of("level", level.getLevel(), "channels", level.getChannels().toString()));
            eventPublisher.publishAlert(alert, "ESCALATED");
        } else {
            log.info("Repeating level {} notifications for alert {} ({} of {})", level.getLevel(),
                    alert.getId(), alert.getRepeatCount(),
                    level.getMaxRepeats() != null ? level.getMaxRepeats() : "unbounded");
        }

        return alertService.notify(alert, level.getChannels(), level.getRecipients(), level.getLevel())
                .thenReturn(planned.step());
    }

    // ========== Private Methods ==========

    private record Planned(Step step, EscalationLevel level) {
    }

    private Optional<EscalationPolicy> policyOf(Alert alert) {
        if (alert.getRuleId() == null) {
            return Optional.empty();
        }
        return ruleEngine.findRule(alert.getRuleId())
                .map(AlertRule::getEscalation)
                .filter(p -> p != null && p.isEnabled() && p.getLevels() != null && !p.getLevels().isEmpty());
    }

    /**
     * Must be called while holding the alert's monitor.
     */
    private Planned plan(Alert alert, EscalationPolicy policy, Instant now) {
        int current = alert.getEscalationLevel();

        if (current == 0) {
            if (policy.getMaxEscalations() < 1 || !elapsed(alert.getTimestamp(), policy.getTimeout(), now)) {
                return null;
            }
            return policy.getLevel(1).map(level -> new Planned(Step.ESCALATED, level)).orElse(null);
        }

        Optional<EscalationLevel> currentLevel = policy.getLevel(current);
        if (currentLevel.isEmpty()) {
            return null;
        }
        // Repeats restart the repeat interval but never the level timeout.
        Optional<EscalationLevel> next = policy.getLevel(current + 1);
        if (current < policy.getMaxEscalations() && next.isPresent()
                && elapsed(alert.getEscalatedAt(), currentLevel.get().getTimeout(), now)) {
            return new Planned(Step.ESCALATED, next.get());
        }

        Instant lastAtLevel = alert.latestNotificationAt(current)
                .map(Notification::getSentAt)
                .orElse(alert.getEscalatedAt());
        EscalationLevel level = currentLevel.get();
        if (level.repeats() && belowRepeatCap(alert, level)
                && elapsed(lastAtLevel, level.getRepeatInterval(), now)) {
            return new Planned(Step.REPEATED, level);
        }
        return null;
    }

    private static boolean belowRepeatCap(Alert alert, EscalationLevel level) {
        return level.getMaxRepeats() == null || alert.getRepeatCount() < level.getMaxRepeats();
    }

    private static boolean elapsed(Instant since, int minutes, Instant now) {
        if (since == null) {
            return false;
        }
        return Duration.between(since, now).compareTo(Duration.ofMinutes(minutes)) >= 0;
    }
}
