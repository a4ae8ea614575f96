package com.z254.sentinel.domain.model;

/**
 * Optional criteria for alert queries. A {@code null} field matches everything.
 */
public record AlertFilter(
        AlertStatus status,
        Severity severity,
        String category,
        String ruleId
) {

    public static AlertFilter all() {
        return new AlertFilter(null, null, null, null);
    }

    public boolean matches(Alert alert) {
        return (status == null || status == alert.getStatus())
                && (severity == null || severity == alert.getSeverity())
                && (category == null || category.equals(alert.getCategory()))
                && (ruleId == null || ruleId.equals(alert.getRuleId()));
    }
}
