package com.z254.sentinel.alerting;

import com.z254.sentinel.domain.model.AlertRule;
import com.z254.sentinel.domain.model.ConditionOperator;
import com.z254.sentinel.domain.model.EscalationLevel;
import com.z254.sentinel.domain.model.EscalationPolicy;
import com.z254.sentinel.domain.model.MetricValue;
import com.z254.sentinel.exception.ConfigurationException;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Rejects rule definitions that could never evaluate correctly.
 */
@Component
public class AlertRuleValidator {

    public void validate(AlertRule rule) {
        List<String> violations = new ArrayList<>();

        if (isBlank(rule.getId())) violations.add("id is required");
        if (isBlank(rule.getName())) violations.add("name is required");
        if (rule.getSeverity() == null) violations.add("severity is required");
        if (rule.getCooldown() < 0) violations.add("cooldown must be >= 0");
        if (rule.getMaxAlerts() < 1) violations.add("maxAlerts must be >= 1");

        validateCondition("condition", rule.getCondition(), violations);
        validateSchedule(rule.getSchedule(), violations);
        validateEscalation(rule.getEscalation(), violations);

        if (rule.getSuppressionRules() != null) {
            for (int i = 0; i < rule.getSuppressionRules().size(); i++) {
                AlertRule.SuppressionRule suppression = rule.getSuppressionRules().get(i);
                String path = "suppressionRules[" + i + "]";
                validateCondition(path + ".condition", suppression.getCondition(), violations);
                if (suppression.getDuration() <= 0) violations.add(path + ".duration must be > 0");
            }
        }

        if (!violations.isEmpty()) {
            throw new ConfigurationException(rule.getId() != null ? rule.getId() : "<new rule>", violations);
        }
    }

    // ========== Private Methods ==========

    private void validateCondition(String path, AlertRule.Condition condition, List<String> violations) {
        if (condition == null) {
            violations.add(path + " is required");
            return;
        }
        if (isBlank(condition.getMetric())) violations.add(path + ".metric is required");
        if (condition.getOperator() == null) violations.add(path + ".operator is required");
        if (condition.getThreshold() == null) violations.add(path + ".threshold is required");
        if (condition.getDuration() < 0) violations.add(path + ".duration must be >= 0");
        if (condition.getTimeWindow() < 0) violations.add(path + ".timeWindow must be >= 0");
        if (condition.getAggregation() != null && condition.getTimeWindow() == 0) {
            violations.add(path + ".timeWindow must be > 0 when aggregation is set");
        }
        if (condition.getOperator() == null || condition.getThreshold() == null) {
            return;
        }
        if (condition.getOperator().isNumeric() && !(condition.getThreshold() instanceof MetricValue.NumericValue)) {
            violations.add(path + ".threshold must be numeric for operator " + condition.getOperator());
        }
        if (condition.getOperator() == ConditionOperator.REGEX) {
            try {
                Pattern.compile(condition.getThreshold().asText());
            } catch (PatternSyntaxException e) {
                violations.add(path + ".threshold is not a valid regex: " + e.getDescription());
            }
        }
    }

    private void validateSchedule(AlertRule.Schedule schedule, List<String> violations) {
        if (schedule == null) {
            return;
        }
        if (schedule.getTimezone() != null) {
            try {
                ZoneId.of(schedule.getTimezone());
            } catch (DateTimeException e) {
                violations.add("schedule.timezone is not a valid zone: " + schedule.getTimezone());
            }
        }
        AlertRule.BusinessHours hours = schedule.getBusinessHours();
        if (hours != null) {
            LocalTime start = parseTime("schedule.businessHours.start", hours.getStart(), violations);
            LocalTime end = parseTime("schedule.businessHours.end", hours.getEnd(), violations);
            if (start != null && end != null && end.isBefore(start)) {
                violations.add("schedule.businessHours.end must not be before start");
            }
            if (hours.getDays() == null || hours.getDays().isEmpty()) {
                violations.add("schedule.businessHours.days must not be empty");
            } else if (hours.getDays().stream().anyMatch(d -> d == null || d < 0 || d > 6)) {
                violations.add("schedule.businessHours.days must be within 0 (Sunday) to 6");
            }
        }
        if (schedule.getMaintenanceWindows() != null) {
            for (AlertRule.MaintenanceWindow window : schedule.getMaintenanceWindows()) {
                if (window.getStart() == null || window.getEnd() == null) {
                    violations.add("maintenance window requires start and end");
                } else if (window.getEnd().isBefore(window.getStart())) {
                    violations.add("maintenance window end must not be before start");
                }
            }
        }
    }

    private void validateEscalation(EscalationPolicy policy, List<String> violations) {
        if (policy == null || !policy.isEnabled()) {
            return;
        }
        if (policy.getTimeout() < 0) violations.add("escalation.timeout must be >= 0");
        if (policy.getMaxEscalations() < 0) violations.add("escalation.maxEscalations must be >= 0");
        List<EscalationLevel> levels = policy.getLevels() == null ? List.of() : policy.getLevels();
        if (policy.getMaxEscalations() > levels.size()) {
            violations.add("escalation.maxEscalations exceeds the number of levels");
        }
        for (int i = 0; i < levels.size(); i++) {
            EscalationLevel level = levels.get(i);
            if (level.getLevel() != i + 1) {
                violations.add("escalation.levels must be numbered 1.." + levels.size() + " in order");
                break;
            }
            if (level.getTimeout() < 0) violations.add("escalation.levels[" + i + "].timeout must be >= 0");
            if (level.getRepeatInterval() != null && level.getRepeatInterval() < 0) {
                violations.add("escalation.levels[" + i + "].repeatInterval must be >= 0");
            }
            if (level.getMaxRepeats() != null && level.getMaxRepeats() < 0) {
                violations.add("escalation.levels[" + i + "].maxRepeats must be >= 0");
            }
        }
    }

    private static LocalTime parseTime(String path, String value, List<String> violations) {
        if (value == null) {
            violations.add(path + " is required");
            return null;
        }
        try {
            return LocalTime.parse(value, ScheduleWindow.HOURS_FORMAT);
        } catch (DateTimeParseException e) {
            violations.add(path + " must be HH:mm");
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
