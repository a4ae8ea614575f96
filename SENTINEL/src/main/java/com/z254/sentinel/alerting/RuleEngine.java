package com.z254.sentinel.alerting;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.AlertRule;
import com.z254.sentinel.domain.model.MetricValue;
import com.z254.sentinel.exception.ConfigurationException;
import com.z254.sentinel.exception.EvaluationException;
import com.z254.sentinel.exception.NotFoundException;
import com.z254.sentinel.observability.SentinelMetrics;
import com.z254.sentinel.observability.SentinelStructuredLogger;
import com.z254.sentinel.observability.SentinelStructuredLogger.RuleEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates alert rules against the metric source once per tick.
 * <p>
 * Each observation is taken to cover one evaluation interval, so a condition has held for
 * {@code now - conditionStartTime + interval}. A rule fires once that reaches
 * {@code condition.duration} minutes and {@link RuleState#tryReserve} grants a slot; the check and
 * the reservation are one atomic step per rule.
 */
@Slf4j
@Service
public class RuleEngine {

    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();
    private final Map<String, RuleState> states = new ConcurrentHashMap<>();

    private final ConditionEvaluator conditionEvaluator;
    private final ScheduleWindow scheduleWindow;
    private final AlertRuleValidator validator;
    private final AlertService alertService;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final SentinelProperties properties;
    private final Clock clock;

    public RuleEngine(ConditionEvaluator conditionEvaluator,
                      ScheduleWindow scheduleWindow,
                      AlertRuleValidator validator,
                      AlertService alertService,
                      SentinelMetrics metrics,
                      SentinelStructuredLogger structuredLogger,
                      SentinelProperties properties,
                      Clock clock) {
        this.conditionEvaluator = conditionEvaluator;
        this.scheduleWindow = scheduleWindow;
        this.validator = validator;
        this.alertService = alertService;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Result of evaluating one rule on one tick.
     */
    public enum Outcome {
        DISABLED, OUTSIDE_SCHEDULE, NO_DATA, CONDITION_NOT_MET, DEBOUNCING, RATE_LIMITED, FIRED, SUPPRESSED, FAILED
    }

    // ========== Rule Administration ==========

    public AlertRule addRule(AlertRule rule) {
        validator.validate(rule);
        if (rules.putIfAbsent(rule.getId(), rule) != null) {
            throw new ConfigurationException(rule.getId(), "rule already exists");
        }
        states.put(rule.getId(), new RuleState());
        structuredLogger.logRuleEvent(rule.getId(), RuleEventType.ADDED, "Added alert rule", null);
        return rule;
    }

    /**
     * Replace a rule definition. The rule's evaluation state is kept.
     */
    public AlertRule updateRule(String ruleId, AlertRule updated) {
        AlertRule rule = updated.toBuilder().id(ruleId).build();
        validator.validate(rule);
        if (rules.replace(ruleId, rule) == null) {
            throw new NotFoundException("Rule", ruleId);
        }
        structuredLogger.logRuleEvent(ruleId, RuleEventType.UPDATED, "Updated alert rule", null);
        return rule;
    }

    public void removeRule(String ruleId) {
        if (rules.remove(ruleId) == null) {
            throw new NotFoundException("Rule", ruleId);
        }
        states.remove(ruleId);
        structuredLogger.logRuleEvent(ruleId, RuleEventType.REMOVED, "Removed alert rule", null);
    }

    public Optional<AlertRule> findRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public AlertRule getRule(String ruleId) {
        return findRule(ruleId).orElseThrow(() -> new NotFoundException("Rule", ruleId));
    }

    public List<AlertRule> getRules() {
        return rules.values().stream()
                .sorted(Comparator.comparing(AlertRule::getId))
                .toList();
    }

    public Optional<RuleState> getState(String ruleId) {
        return Optional.ofNullable(states.get(ruleId));
    }

    // ========== Evaluation ==========

    /**
     * Evaluate every enabled rule. A failing rule is logged and does not affect its siblings.
     */
    public Map<String, Outcome> evaluateAll() {
        Map<String, Outcome> outcomes = new LinkedHashMap<>();
        for (AlertRule rule : getRules()) {
            if (!rule.isEnabled()) {
                continue;
            }
            outcomes.put(rule.getId(), evaluateSafely(rule));
        }
        return outcomes;
    }

    public Outcome evaluateRule(String ruleId) {
        return evaluateSafely(getRule(ruleId));
    }

    /**
     * Check the cooldown and the trailing-hour {@code maxAlerts} limit and, when both allow it,
     * reserve the slot. A second call within the cooldown therefore returns {@code false}.
     */
    public boolean shouldTriggerAlert(AlertRule rule) {
        return shouldTriggerAlert(rule, stateOf(rule), clock.instant());
    }

    // ========== Private Methods ==========

    private Outcome evaluateSafely(AlertRule rule) {
        try {
            return evaluate(rule, clock.instant());
        } catch (EvaluationException e) {
            metrics.recordRuleError();
            structuredLogger.logRuleEvent(rule.getId(), RuleEventType.EVALUATION_FAILED,
                    "Metric source unavailable", Map.of("error", String.valueOf(e.getMessage())));
            return Outcome.FAILED;
        } catch (RuntimeException e) {
            metrics.recordRuleError();
            log.error("Error evaluating rule {}", rule.getId(), e);
            return Outcome.FAILED;
        }
    }

    private Outcome evaluate(AlertRule rule, Instant now) {
        if (!rule.isEnabled()) {
            return Outcome.DISABLED;
        }
        Optional<String> blocked = scheduleWindow.inactiveReason(rule.getSchedule(), now);
        if (blocked.isPresent()) {
            structuredLogger.logRuleEvent(rule.getId(), RuleEventType.SKIPPED, blocked.get(), null);
            return Outcome.OUTSIDE_SCHEDULE;
        }

        Optional<MetricValue> value = conditionEvaluator.resolveValue(rule.getCondition(), now);
        if (value.isEmpty()) {
            log.debug("No value for metric {} of rule {}", rule.getCondition().getMetric(), rule.getId());
            return Outcome.NO_DATA;
        }

        boolean conditionMet = conditionEvaluator.evaluate(rule.getCondition(), value.get());
        RuleState state = stateOf(rule);

        synchronized (state) {
            if (!conditionMet) {
                state.conditionCleared();
                return Outcome.CONDITION_NOT_MET;
            }
            Instant since = state.conditionObserved(now);
            Duration held = Duration.between(since, now).plus(properties.getScheduling().getRuleEvaluationInterval());
            if (held.compareTo(Duration.ofMinutes(rule.getCondition().getDuration())) < 0) {
                return Outcome.DEBOUNCING;
            }
            if (!shouldTriggerAlert(rule, state, now)) {
                metrics.recordRateLimited();
                structuredLogger.logRuleEvent(rule.getId(), RuleEventType.RATE_LIMITED,
                        "Alert suppressed by cooldown or rate limit", Map.of("recentAlerts", state.recentFireCount()));
                return Outcome.RATE_LIMITED;
            }
        }

        AlertRule.SuppressionRule suppression = activeSuppression(rule, now).orElse(null);
        alertService.createRuleAlert(rule, value.get(), suppression);
        metrics.recordRuleFired();
        structuredLogger.logRuleEvent(rule.getId(), RuleEventType.FIRED, "Rule fired",
                Map.of("value", value.get().asText(), "suppressed", suppression != null));
        return suppression != null ? Outcome.SUPPRESSED : Outcome.FIRED;
    }

    private boolean shouldTriggerAlert(AlertRule rule, RuleState state, Instant now) {
        return state.tryReserve(now,
                Duration.ofMinutes(rule.getCooldown()),
                rule.getMaxAlerts(),
                properties.getRules().getRateLimitWindow());
    }

    /**
     * First suppression rule whose condition holds now. A suppression metric without a value
     * does not suppress.
     */
    private Optional<AlertRule.SuppressionRule> activeSuppression(AlertRule rule, Instant now) {
        if (rule.getSuppressionRules() == null) {
            return Optional.empty();
        }
        for (AlertRule.SuppressionRule suppression : rule.getSuppressionRules()) {
            try {
                Optional<MetricValue> value = conditionEvaluator.resolveValue(suppression.getCondition(), now);
                if (value.isPresent() && conditionEvaluator.evaluate(suppression.getCondition(), value.get())) {
                    return Optional.of(suppression);
                }
            } catch (EvaluationException e) {
                log.warn("Suppression rule {} of rule {} could not be evaluated: {}",
                        suppression.getId(), rule.getId(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    private RuleState stateOf(AlertRule rule) {
        return states.computeIfAbsent(rule.getId(), id -> new RuleState());
    }
}
