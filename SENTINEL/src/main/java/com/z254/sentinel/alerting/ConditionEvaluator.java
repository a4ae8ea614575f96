package com.z254.sentinel.alerting;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.sentinel.domain.model.Aggregation;
import com.z254.sentinel.domain.model.AlertRule;
import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.MetricValue;
import com.z254.sentinel.exception.EvaluationException;
import com.z254.sentinel.metrics.MetricSource;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;

/**
 * Resolves a condition's metric value and compares it with the threshold.
 * <p>
 * Ordering operators compare numerically and are false for a value that is not a number.
 * {@code EQ}/{@code NEQ} compare numerically when both sides are numbers and by text otherwise,
 * so health-style string metrics can be matched. {@code REGEX} looks for a match anywhere in the value.
 */
@Component
public class ConditionEvaluator {

    private final MetricSource metricSource;
    private final Cache<String, Pattern> patterns = Caffeine.newBuilder()
            .maximumSize(500)
            .build();

    public ConditionEvaluator(MetricSource metricSource) {
        this.metricSource = metricSource;
    }

    /**
     * Current value of the condition's metric, aggregated over {@code timeWindow} minutes when an
     * aggregation is set and the metric is numeric. An empty window falls back to the latest value.
     *
     * @throws EvaluationException when the metric source fails
     */
    public Optional<MetricValue> resolveValue(AlertRule.Condition condition, Instant now) {
        Optional<MetricValue> latest;
        try {
            latest = metricSource.getMetricValue(condition.getMetric());
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Metric source failed for " + condition.getMetric(), e);
        }
        if (latest.isEmpty() || condition.getAggregation() == null || condition.getTimeWindow() <= 0
                || !(latest.get() instanceof MetricValue.NumericValue)) {
            return latest;
        }

        List<MetricSample> window;
        try {
            window = metricSource.getHistoricalSeries(condition.getMetric(),
                    now.minus(Duration.ofMinutes(condition.getTimeWindow())), now);
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Metric history unavailable for " + condition.getMetric(), e);
        }
        if (window.isEmpty()) {
            return latest;
        }
        return Optional.of(MetricValue.of(aggregate(condition.getAggregation(), window)));
    }

    public boolean evaluate(AlertRule.Condition condition, MetricValue value) {
        MetricValue threshold = condition.getThreshold();
        return switch (condition.getOperator()) {
            case GT -> ordered(value, threshold, c -> c > 0);
            case GTE -> ordered(value, threshold, c -> c >= 0);
            case LT -> ordered(value, threshold, c -> c < 0);
            case LTE -> ordered(value, threshold, c -> c <= 0);
            case EQ -> isEqual(value, threshold);
            case NEQ -> !isEqual(value, threshold);
            case CONTAINS -> value.asText().contains(threshold.asText());
            case NOT_CONTAINS -> !value.asText().contains(threshold.asText());
            case REGEX -> patterns.get(threshold.asText(), Pattern::compile)
                    .matcher(value.asText())
                    .find();
        };
    }

    static double aggregate(Aggregation aggregation, List<MetricSample> window) {
        return switch (aggregation) {
            case AVG -> window.stream().mapToDouble(MetricSample::value).average().orElse(0);
            case SUM -> window.stream().mapToDouble(MetricSample::value).sum();
            case MIN -> window.stream().mapToDouble(MetricSample::value).min().orElse(0);
            case MAX -> window.stream().mapToDouble(MetricSample::value).max().orElse(0);
            case COUNT -> window.size();
            case RATE -> rate(window);
        };
    }

    // ========== Private Methods ==========

    /**
     * Numeric comparison; false whenever either side is not a number.
     */
    private static boolean ordered(MetricValue value, MetricValue threshold, IntPredicate test) {
        OptionalDouble left = number(value);
        OptionalDouble right = number(threshold);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        return test.test(Double.compare(left.getAsDouble(), right.getAsDouble()));
    }

    private static boolean isEqual(MetricValue value, MetricValue threshold) {
        if (value instanceof MetricValue.NumericValue left && threshold instanceof MetricValue.NumericValue right) {
            return Double.compare(left.value(), right.value()) == 0;
        }
        return value.asText().equals(threshold.asText());
    }

    private static OptionalDouble number(MetricValue value) {
        if (value instanceof MetricValue.NumericValue numeric) {
            return OptionalDouble.of(numeric.value());
        }
        try {
            return OptionalDouble.of(Double.parseDouble(value.asText().trim()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static double rate(List<MetricSample> window) {
        if (window.size() < 2) {
            return 0;
        }
        MetricSample first = window.get(0);
        MetricSample last = window.get(window.size() - 1);
        double minutes = Duration.between(first.timestamp(), last.timestamp()).toMillis() / 60_000.0;
        return minutes <= 0 ? 0 : (last.value() - first.value()) / minutes;
    }
}
