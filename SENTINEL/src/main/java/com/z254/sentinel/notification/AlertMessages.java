package com.z254.sentinel.notification;

import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.MetricValue;
import com.z254.sentinel.domain.model.Severity;

/**
 * Text fragments shared by the channel payloads.
 */
public final class AlertMessages {

    private AlertMessages() {
    }

    public static String emoji(Severity severity) {
        return switch (severity) {
            case LOW -> "🟢";
            case MEDIUM -> "🟡";
            case HIGH -> "🟠";
            case CRITICAL -> "🔴";
        };
    }

    /**
     * Slack attachment color.
     */
    public static String color(Severity severity) {
        return switch (severity) {
            case LOW -> "good";
            case MEDIUM -> "warning";
            case HIGH, CRITICAL -> "danger";
        };
    }

    public static String headline(Alert alert) {
        return emoji(alert.getSeverity()) + " " + alert.getSeverity().name() + ": " + alert.getTitle();
    }

    public static String text(MetricValue value) {
        return value == null ? "n/a" : value.asText();
    }

    public static String metric(Alert alert) {
        return alert.getContext() == null ? "n/a" : alert.getContext().getMetric();
    }

    public static String environment(Alert alert) {
        return alert.getContext() == null ? "n/a" : alert.getContext().getEnvironment();
    }

    public static String value(Alert alert) {
        return alert.getContext() == null ? "n/a" : text(alert.getContext().getValue());
    }

    public static String threshold(Alert alert) {
        return alert.getContext() == null ? "n/a" : text(alert.getContext().getThreshold());
    }
}
