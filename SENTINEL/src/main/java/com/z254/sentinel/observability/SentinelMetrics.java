package com.z254.sentinel.observability;

import com.z254.sentinel.domain.model.NotificationChannel;
import com.z254.sentinel.domain.model.Severity;
import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics for SENTINEL service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Training and detection runs (duration, insufficient data, anomalies by severity)</li>
 *     <li>Rule evaluation (fired, rate limited, suppressed, evaluation errors)</li>
 *     <li>Alert lifecycle (created, acknowledged, resolved, escalated)</li>
 *     <li>Notification delivery per channel</li>
 * </ul>
 */
@Component
public class SentinelMetrics {

    private final MeterRegistry meterRegistry;

    // Detection metrics
    @Getter
    private final Counter trainingRuns;
    @Getter
    private final Counter trainingSkipped;
    @Getter
    private final Counter detectionErrors;
    private final Timer trainingDuration;
    private final DistributionSummary anomalyScore;
    private final Map<String, Counter> anomaliesBySeverity = new ConcurrentHashMap<>();

    // Rule metrics
    @Getter
    private final Counter rulesFired;
    @Getter
    private final Counter rulesRateLimited;
    @Getter
    private final Counter rulesEvaluationErrors;
    @Getter
    private final Counter alertsSuppressed;

    // Alert metrics
    @Getter
    private final Counter alertsCreated;
    @Getter
    private final Counter alertsAcknowledged;
    @Getter
    private final Counter alertsResolved;
    @Getter
    private final Counter alertsEscalated;

    // Notification metrics
    private final Map<String, Counter> notificationsByOutcome = new ConcurrentHashMap<>();
    private final Timer dispatchLatency;

    public SentinelMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.trainingRuns = Counter.builder("sentinel.detectors.training.runs")
                .description("Detector training runs completed")
                .register(meterRegistry);
        this.trainingSkipped = Counter.builder("sentinel.detectors.training.skipped")
                .description("Training runs skipped for insufficient data")
                .register(meterRegistry);
        this.detectionErrors = Counter.builder("sentinel.detectors.errors")
                .description("Detection or training failures")
                .register(meterRegistry);
        this.trainingDuration = Timer.builder("sentinel.detectors.training.duration")
                .description("Detector training duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.anomalyScore = DistributionSummary.builder("sentinel.anomalies.score")
                .description("Anomaly scores")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);

        this.rulesFired = Counter.builder("sentinel.rules.fired")
                .description("Rule evaluations that created an alert")
                .register(meterRegistry);
        this.rulesRateLimited = Counter.builder("sentinel.rules.rate_limited")
                .description("Fire attempts rejected by cooldown or maxAlerts")
                .register(meterRegistry);
        this.rulesEvaluationErrors = Counter.builder("sentinel.rules.errors")
                .description("Rule evaluations that failed")
                .register(meterRegistry);
        this.alertsSuppressed = Counter.builder("sentinel.alerts.suppressed")
                .description("Alerts stored as suppressed")
                .register(meterRegistry);

        this.alertsCreated = Counter.builder("sentinel.alerts.created")
                .description("Total alerts created")
                .register(meterRegistry);
        this.alertsAcknowledged = Counter.builder("sentinel.alerts.acknowledged")
                .description("Total alerts acknowledged")
                .register(meterRegistry);
        this.alertsResolved = Counter.builder("sentinel.alerts.resolved")
                .description("Total alerts resolved")
                .register(meterRegistry);
        this.alertsEscalated = Counter.builder("sentinel.alerts.escalated")
                .description("Escalation level transitions")
                .register(meterRegistry);

        this.dispatchLatency = Timer.builder("sentinel.notifications.dispatch.latency")
                .description("Time to complete a fan-out dispatch")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    // ========== Detection Methods ==========

    public Timer.Sample startTrainingTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTrainingCompleted(Timer.Sample sample) {
        sample.stop(trainingDuration);
        trainingRuns.increment();
    }

    public void recordTrainingSkipped() {
        trainingSkipped.increment();
    }

    public void recordDetectionError() {
        detectionErrors.increment();
    }

    public void recordAnomaly(Severity severity, double score) {
        anomalyScore.record(score);
        anomaliesBySeverity.computeIfAbsent(severity.name(), s ->
                Counter.builder("sentinel.anomalies.detected")
                        .tag("severity", s.toLowerCase())
                        .description("Anomalies detected by severity")
                        .register(meterRegistry))
                .increment();
    }

    // ========== Rule Methods ==========

    public void recordRuleFired() {
        rulesFired.increment();
    }

    public void recordRateLimited() {
        rulesRateLimited.increment();
    }

    public void recordRuleError() {
        rulesEvaluationErrors.increment();
    }

    // ========== Alert Methods ==========

    public void recordAlertCreated() {
        alertsCreated.increment();
    }

    public void recordAlertSuppressed() {
        alertsSuppressed.increment();
    }

    public void recordAlertAcknowledged() {
        alertsAcknowledged.increment();
    }

    public void recordAlertResolved() {
        alertsResolved.increment();
    }

    public void recordAlertEscalated() {
        alertsEscalated.increment();
    }

    // ========== Notification Methods ==========

    public Timer.Sample startDispatchTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordDispatchCompleted(Timer.Sample sample) {
        sample.stop(dispatchLatency);
    }

    public void recordNotification(NotificationChannel channel, boolean sent) {
        String outcome = sent ? "sent" : "failed";
        notificationsByOutcome.computeIfAbsent(channel.name() + ":" + outcome, key ->
                Counter.builder("sentinel.notifications")
                        .tag("channel", channel.name().toLowerCase())
                        .tag("outcome", outcome)
                        .description("Notification attempts by channel and outcome")
                        .register(meterRegistry))
                .increment();
    }
}
