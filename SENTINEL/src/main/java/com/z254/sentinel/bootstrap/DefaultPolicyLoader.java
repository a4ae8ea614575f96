package com.z254.sentinel.bootstrap;

import com.z254.sentinel.alerting.RuleEngine;
import com.z254.sentinel.detection.DetectorRegistry;
import com.z254.sentinel.domain.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.*;

import static com.z254.sentinel.domain.model.NotificationChannel.*;

/**
 * Seeds the built-in detectors and alert rules at startup.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sentinel.defaults", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DefaultPolicyLoader implements ApplicationRunner {

    private final DetectorRegistry detectorRegistry;
    private final RuleEngine ruleEngine;

    public DefaultPolicyLoader(DetectorRegistry detectorRegistry, RuleEngine ruleEngine) {
        this.detectorRegistry = detectorRegistry;
        this.ruleEngine = ruleEngine;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<DetectorConfig> detectors = defaultDetectors();
        detectors.forEach(detectorRegistry::addDetector);
        log.info("Initialized {} anomaly detectors", detectors.size());

        List<AlertRule> rules = defaultRules();
        rules.forEach(ruleEngine::addRule);
        log.info("Loaded {} default alert rules", rules.size());
    }

    static List<DetectorConfig> defaultDetectors() {
        return List.of(
                DetectorConfig.builder()
                        .id("response_time_anomaly")
                        .name("Response Time Anomaly Detection")
                        .metric("response_time")
                        .algorithm(AnomalyAlgorithm.SEASONAL_HYBRID)
                        .sensitivity(0.7)
                        .minDataPoints(50)
                        .trainingWindow(Duration.ofDays(7))
                        .detectionWindow(Duration.ofMinutes(5))
                        .seasonality(seasonal())
                        .thresholds(new DetectorConfig.Thresholds(0.3, 0.5, 0.7, 0.9))
                        .prediction(new DetectorConfig.PredictionSettings(true, 30, 0.6))
                        .alerting(alerting(15, true, SLACK, EMAIL))
                        .build(),
                DetectorConfig.builder()
                        .id("error_rate_anomaly")
                        .name("Error Rate Anomaly Detection")
                        .metric("error_rate")
                        .algorithm(AnomalyAlgorithm.STATISTICAL)
                        .sensitivity(0.8)
                        .minDataPoints(30)
                        .trainingWindow(Duration.ofDays(3))
                        .detectionWindow(Duration.ofMinutes(5))
                        .seasonality(DetectorConfig.Seasonality.builder()
                                .enabled(false)
                                .components(new ArrayList<>(List.of("trend", "residual")))
                                .build())
                        .thresholds(new DetectorConfig.Thresholds(0.4, 0.6, 0.8, 0.95))
                        .prediction(new DetectorConfig.PredictionSettings(true, 15, 0.7))
                        .alerting(alerting(10, true, SLACK, EMAIL, PAGERDUTY))
                        .build(),
                DetectorConfig.builder()
                        .id("memory_usage_anomaly")
                        .name("Memory Usage Anomaly Detection")
                        .metric("memory_usage")
                        .algorithm(AnomalyAlgorithm.SEASONAL_HYBRID)
                        .sensitivity(0.6)
                        .minDataPoints(100)
                        .trainingWindow(Duration.ofDays(7))
                        .detectionWindow(Duration.ofMinutes(10))
                        .seasonality(seasonal())
                        .thresholds(new DetectorConfig.Thresholds(0.3, 0.5, 0.7, 0.9))
                        .prediction(new DetectorConfig.PredictionSettings(true, 60, 0.6))
                        .alerting(alerting(30, false, SLACK, EMAIL))
                        .build());
    }

    static List<AlertRule> defaultRules() {
        return List.of(
                AlertRule.builder()
                        .id("high_error_rate")
                        .name("High Error Rate")
                        .description("Application error rate is above acceptable threshold")
                        .severity(Severity.HIGH)
                        .category("system")
                        .condition(condition("error_rate", ConditionOperator.GT, MetricValue.of(5), 5, Aggregation.AVG, 10))
                        .escalation(EscalationPolicy.builder()
                                .timeout(15)
                                .maxEscalations(2)
                                .levels(new ArrayList<>(List.of(
                                        level(1, 15, 30, 3, Map.of(SLACK, List.of("#alerts"))),
                                        level(2, 30, null, null, Map.of(
                                                EMAIL, List.of("oncall@company.com"),
                                                PAGERDUTY, List.of("oncall-service"))))))
                                .build())
                        .channels(List.of(SLACK, EMAIL))
                        .recipients(Map.of(SLACK, List.of("#alerts"), EMAIL, List.of("team@company.com")))
                        .cooldown(30)
                        .maxAlerts(10)
                        .build(),
                AlertRule.builder()
                        .id("critical_memory_usage")
                        .name("Critical Memory Usage")
                        .description("Memory usage is critically high")
                        .severity(Severity.CRITICAL)
                        .category("infrastructure")
                        .condition(condition("memory_usage_percent", ConditionOperator.GT, MetricValue.of(90), 2, Aggregation.AVG, 5))
                        .escalation(EscalationPolicy.builder()
                                .timeout(5)
                                .maxEscalations(1)
                                .levels(new ArrayList<>(List.of(
                                        level(1, 5, 10, 5, Map.of(
                                                SLACK, List.of("#critical-alerts"),
                                                PAGERDUTY, List.of("critical-service"))))))
                                .build())
                        .channels(List.of(SLACK, PAGERDUTY))
                        .recipients(Map.of(SLACK, List.of("#critical-alerts"), PAGERDUTY, List.of("critical-service")))
                        .cooldown(10)
                        .maxAlerts(20)
                        .build(),
                AlertRule.builder()
                        .id("database_connection_failure")
                        .name("Database Connection Failure")
                        .description("Unable to connect to database")
                        .severity(Severity.CRITICAL)
                        .category("infrastructure")
                        .condition(condition("database_health", ConditionOperator.EQ, MetricValue.of("unhealthy"), 1, Aggregation.COUNT, 1))
                        .escalation(EscalationPolicy.builder()
                                .timeout(2)
                                .maxEscalations(1)
                                .levels(new ArrayList<>(List.of(
                                        level(1, 2, 5, 10, Map.of(
                                                SLACK, List.of("#critical-alerts"),
                                                EMAIL, List.of("dba@company.com", "oncall@company.com"),
                                                PAGERDUTY, List.of("database-service"))))))
                                .build())
                        .channels(List.of(SLACK, EMAIL, PAGERDUTY))
                        .recipients(Map.of(
                                SLACK, List.of("#critical-alerts"),
                                EMAIL, List.of("dba@company.com"),
                                PAGERDUTY, List.of("database-service")))
                        .cooldown(5)
                        .maxAlerts(50)
                        .build(),
                AlertRule.builder()
                        .id("slow_response_time")
                        .name("Slow Response Time")
                        .description("API response time is above acceptable threshold")
                        .severity(Severity.MEDIUM)
                        .category("performance")
                        .condition(condition("response_time_p95", ConditionOperator.GT, MetricValue.of(2000), 10, Aggregation.AVG, 15))
                        .schedule(AlertRule.Schedule.builder()
                                .businessHours(AlertRule.BusinessHours.builder().start("09:00").end("17:00").build())
                                .build())
                        .escalation(EscalationPolicy.builder()
                                .timeout(30)
                                .maxEscalations(2)
                                .levels(new ArrayList<>(List.of(
                                        level(1, 30, 60, 2, Map.of(SLACK, List.of("#performance-alerts"))),
                                        level(2, 60, null, null, Map.of(EMAIL, List.of("performance-team@company.com"))))))
                                .build())
                        .channels(List.of(SLACK))
                        .recipients(Map.of(SLACK, List.of("#performance-alerts")))
                        .cooldown(60)
                        .maxAlerts(5)
                        .build());
    }

    // ========== Private Methods ==========

    private static DetectorConfig.Seasonality seasonal() {
        return DetectorConfig.Seasonality.builder().enabled(true).period(24).build();
    }

    private static DetectorConfig.AlertingSettings alerting(int cooldown, boolean escalation,
                                                            NotificationChannel... channels) {
        Map<NotificationChannel, List<String>> recipients = new EnumMap<>(NotificationChannel.class);
        for (NotificationChannel channel : channels) {
            recipients.put(channel, switch (channel) {
                case SLACK -> List.of("#anomalies");
                case PAGERDUTY -> List.of("oncall-service");
                default -> List.of("oncall@company.com");
            });
        }
        return DetectorConfig.AlertingSettings.builder()
                .enabled(true)
                .cooldown(cooldown)
                .channels(new ArrayList<>(List.of(channels)))
                .recipients(recipients)
                .escalation(escalation)
                .build();
    }

    private static AlertRule.Condition condition(String metric, ConditionOperator operator, MetricValue threshold,
                                                 int duration, Aggregation aggregation, int timeWindow) {
        return AlertRule.Condition.builder()
                .metric(metric)
                .operator(operator)
                .threshold(threshold)
                .duration(duration)
                .aggregation(aggregation)
                .timeWindow(timeWindow)
                .build();
    }

    private static EscalationLevel level(int number, int timeout, Integer repeatInterval, Integer maxRepeats,
                                         Map<NotificationChannel, List<String>> recipients) {
        return EscalationLevel.builder()
                .level(number)
                .timeout(timeout)
                .channels(new ArrayList<>(new TreeSet<>(recipients.keySet())))
                .recipients(new HashMap<>(recipients))
                .repeatInterval(repeatInterval)
                .maxRepeats(maxRepeats)
                .build();
    }
}
