package com.z254.sentinel.alerting;

import com.z254.sentinel.domain.model.Severity;

import java.util.Map;

/**
 * Alert counters for the summary endpoint.
 *
 * @param recent alerts raised within the summary window
 */
public record AlertSummary(
        long total,
        long open,
        long acknowledged,
        long resolved,
        long suppressed,
        long recent,
        Map<Severity, Long> bySeverity
) {
}
