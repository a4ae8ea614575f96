package com.z254.sentinel.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Alert raised by a rule or an anomaly detector.
 * <p>
 * Status is changed by operators through {@code AlertService}; the escalation level is
 * changed only by the escalation scheduler. Both happen while holding the alert's
 * monitor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    private String id;

    private String ruleId;

    private String ruleName;

    private Severity severity;

    @Builder.Default
    private AlertStatus status = AlertStatus.OPEN;

    private String category;

    private String title;

    private String description;

    private Instant timestamp;

    private Instant resolvedAt;

    private Instant acknowledgedAt;

    private String acknowledgedBy;

    private int escalationLevel;

    /** When the current escalation level was entered */
    private Instant escalatedAt;

    /** Repeated notifications sent at the current escalation level */
    private int repeatCount;

    private Instant suppressedUntil;

    private String suppressionReason;

    /** Source anomaly for detector-raised alerts */
    private String anomalyId;

    @Builder.Default
    private List<Notification> notifications = new CopyOnWriteArrayList<>();

    private Context context;

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    @JsonIgnore
    public boolean isOpen() {
        return status == AlertStatus.OPEN;
    }

    /**
     * Most recent notification sent for the given escalation level.
     */
    public Optional<Notification> latestNotificationAt(int level) {
        return notifications.stream()
                .filter(n -> n.getEscalationLevel() == level)
                .max(Comparator.comparing(Notification::getSentAt));
    }

    public void addNotifications(List<Notification> sent) {
        notifications.addAll(sent);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Context {
        private String metric;
        private MetricValue value;
        private MetricValue threshold;
        @Builder.Default
        private Map<String, String> tags = new HashMap<>();
        private String source;
        private String environment;
    }
}
