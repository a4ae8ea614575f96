package com.z254.sentinel.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for SENTINEL service.
 * <p>
 * Emits {@code message | data={...}} lines and scopes the entity id in the MDC
 * ({@code detectorId}, {@code ruleId} or {@code alertId}) for the duration of the call.
 */
@Slf4j
@Component
public class SentinelStructuredLogger {

    // MDC keys
    public static final String MDC_DETECTOR_ID = "detectorId";
    public static final String MDC_RULE_ID = "ruleId";
    public static final String MDC_ALERT_ID = "alertId";
    public static final String MDC_TRACE_ID = "traceId";
    public static final String MDC_SPAN_ID = "spanId";

    /**
     * Log a detector event.
     */
    public void logDetectorEvent(String detectorId, DetectorEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_DETECTOR_ID, detectorId))) {
            Map<String, Object> logData = new HashMap<>();
            logData.put("event", eventType.name());
            logData.put("detectorId", detectorId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case ANOMALY_DETECTED, INSUFFICIENT_DATA ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an alert lifecycle event.
     */
    public void logAlertEvent(String alertId, String ruleId, AlertEventType eventType,
                              String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_ALERT_ID, alertId,
                MDC_RULE_ID, ruleId != null ? ruleId : ""))) {
            Map<String, Object> logData = new HashMap<>();
            logData.put("event", eventType.name());
            logData.put("alertId", alertId);
            if (ruleId != null) {
                logData.put("ruleId", ruleId);
            }
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case CREATED, ESCALATED -> log.warn("{} | data={}", message, formatLogData(logData));
                case NOTIFICATION_FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a rule evaluation event.
     */
    public void logRuleEvent(String ruleId, RuleEventType eventType, String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_RULE_ID, ruleId))) {
            Map<String, Object> logData = new HashMap<>();
            logData.put("event", eventType.name());
            logData.put("ruleId", ruleId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case RATE_LIMITED, SKIPPED -> log.debug("{} | data={}", message, formatLogData(logData));
                case EVALUATION_FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum DetectorEventType {
        ADDED, UPDATED, REMOVED, TRAINED, INSUFFICIENT_DATA, ANOMALY_DETECTED, FAILED
    }

    public enum AlertEventType {
        CREATED, SUPPRESSED, ACKNOWLEDGED, RESOLVED, ESCALATED, NOTIFICATION_FAILED, RETRIED
    }

    public enum RuleEventType {
        ADDED, UPDATED, REMOVED, FIRED, RATE_LIMITED, SKIPPED, EVALUATION_FAILED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
