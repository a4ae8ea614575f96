package com.z254.sentinel.config;

import com.z254.sentinel.domain.model.NotificationChannel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration properties for SENTINEL service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Loop intervals for training, detection, rule evaluation and escalation</li>
 *     <li>Detection limits (anomaly log capacity, time zone)</li>
 *     <li>Notification provider endpoints and send timeout</li>
 *     <li>Kafka topics for metric ingestion and event publishing</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "sentinel")
public class SentinelProperties {

    /** Value reported as {@code context.source} on alerts */
    @NotBlank
    private String source = "sentinel";

    /** Value reported as {@code context.environment} on alerts */
    @NotBlank
    private String environment = "development";

    private final Scheduling scheduling = new Scheduling();
    private final Detection detection = new Detection();
    private final Rules rules = new Rules();
    private final Notifications notifications = new Notifications();
    private final Kafka kafka = new Kafka();
    private final Defaults defaults = new Defaults();

    /**
     * Periodic loop configuration.
     */
    @Data
    public static class Scheduling {
        /** Master switch for all four loops */
        private boolean enabled = true;

        private Duration trainingInterval = Duration.ofHours(6);

        /** Delay before the first training run after startup */
        private Duration trainingInitialDelay = Duration.ofSeconds(30);

        private Duration detectionInterval = Duration.ofMinutes(1);

        private Duration ruleEvaluationInterval = Duration.ofMinutes(1);

        private Duration escalationInterval = Duration.ofSeconds(30);
    }

    /**
     * Anomaly detection configuration.
     */
    @Data
    public static class Detection {
        /** Anomalies retained per detector, oldest evicted first */
        @Positive
        private int anomalyLogCapacity = 1000;

        /** Zone used to derive the hour-of-day phase of seasonal detectors */
        private String zone = "UTC";

        /** Delay before training a newly added or updated detector */
        private Duration retrainDelay = Duration.ofSeconds(1);

        /** Window used for the "recent" counters of the summary */
        private Duration summaryWindow = Duration.ofHours(24);
    }

    /**
     * Alert rule configuration.
     */
    @Data
    public static class Rules {
        /** Trailing window for the per-rule maxAlerts limit */
        private Duration rateLimitWindow = Duration.ofHours(1);

        /** How long resolved alerts stay queryable before they are evicted */
        private Duration resolvedAlertRetention = Duration.ofDays(7);

        /** Samples retained per metric by the in-memory metric source */
        @Positive
        private int metricHistoryCapacity = 20_000;
    }

    /**
     * Notification delivery configuration.
     */
    @Data
    public static class Notifications {
        /** Upper bound for a single provider send */
        private Duration sendTimeout = Duration.ofSeconds(10);

        private final Email email = new Email();
        private final Slack slack = new Slack();
        private final Webhook webhook = new Webhook();
        private final PagerDuty pagerduty = new PagerDuty();

        /** Channels whose provider is registered */
        private Map<NotificationChannel, Boolean> enabledChannels = new EnumMap<>(Map.of(
                NotificationChannel.EMAIL, true,
                NotificationChannel.SLACK, true,
                NotificationChannel.WEBHOOK, true,
                NotificationChannel.PAGERDUTY, true));

        public boolean isChannelEnabled(NotificationChannel channel) {
            return enabledChannels.getOrDefault(channel, false);
        }

        @Data
        public static class Email {
            /** HTTP mail relay endpoint (SendGrid-compatible v3 mail/send) */
            private String relayUrl;
            private String apiKey;
            private String from = "sentinel@localhost";
        }

        @Data
        public static class Slack {
            private String webhookUrl;
        }

        @Data
        public static class Webhook {
            private String url;
        }

        @Data
        public static class PagerDuty {
            private String eventsUrl = "https://events.pagerduty.com/v2/enqueue";
            private String apiKey;
            private String routingKey;
        }
    }

    /**
     * Kafka ingestion and event publishing.
     */
    @Data
    public static class Kafka {
        private boolean enabled = false;

        private final Topics topics = new Topics();

        @Data
        public static class Topics {
            private String metricsInput = "sentinel.metrics.samples";
            private String anomalies = "sentinel.anomalies.detected";
            private String alerts = "sentinel.alerts.events";
        }
    }

    /**
     * Built-in detectors and rules registered at startup.
     */
    @Data
    public static class Defaults {
        private boolean enabled = true;
    }
}
