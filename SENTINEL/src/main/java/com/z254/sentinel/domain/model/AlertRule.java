package com.z254.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative alert rule evaluated on every rule tick.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {

    private String id;

    private String name;

    private String description;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private Severity severity = Severity.MEDIUM;

    @Builder.Default
    private String category = "system";

    private Condition condition;

    @Builder.Default
    private Schedule schedule = new Schedule();

    @Builder.Default
    private EscalationPolicy escalation = EscalationPolicy.disabled();

    @Builder.Default
    private List<NotificationChannel> channels = new ArrayList<>();

    @Builder.Default
    private Map<NotificationChannel, List<String>> recipients = new HashMap<>();

    /** Minutes between two alerts of this rule */
    private int cooldown;

    /** Alerts allowed per trailing hour */
    @Builder.Default
    private int maxAlerts = 10;

    @Builder.Default
    private List<SuppressionRule> suppressionRules = new ArrayList<>();

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Condition {
        private String metric;
        private ConditionOperator operator;
        private MetricValue threshold;

        /** Minutes the condition must hold before the rule fires */
        private int duration;

        private Aggregation aggregation;

        /** Aggregation window in minutes */
        private int timeWindow;

        @Builder.Default
        private Map<String, String> tags = new HashMap<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Schedule {
        @Builder.Default
        private boolean enabled = true;

        @Builder.Default
        private String timezone = "UTC";

        private BusinessHours businessHours;

        @Builder.Default
        private List<MaintenanceWindow> maintenanceWindows = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BusinessHours {
        /** HH:MM */
        private String start;
        /** HH:MM, inclusive */
        private String end;
        /** 0-6, Sunday = 0 */
        @Builder.Default
        private List<Integer> days = new ArrayList<>(List.of(1, 2, 3, 4, 5));
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MaintenanceWindow {
        private Instant start;
        private Instant end;
        private String reason;
    }

    /**
     * While {@link #condition} holds, alerts of the owning rule are created suppressed.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SuppressionRule {
        private String id;
        private String name;
        private Condition condition;
        /** Minutes the created alert stays suppressed */
        private int duration;
        private String reason;
    }
}
