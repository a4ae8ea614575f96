package com.z254.sentinel.metrics;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.MetricValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metric store fed by the ingestion endpoint and the Kafka listener.
 * <p>
 * Keeps the latest value of every metric and a bounded, time-ordered history of numeric samples.
 */
@Slf4j
@Component
public class InMemoryMetricSource implements MetricSource {

    private final Map<String, Observed> latest = new ConcurrentHashMap<>();
    private final Map<String, Deque<MetricSample>> history = new ConcurrentHashMap<>();
    private final int capacity;
    private final Clock clock;

    public InMemoryMetricSource(SentinelProperties properties, Clock clock) {
        this.capacity = properties.getRules().getMetricHistoryCapacity();
        this.clock = clock;
    }

    /**
     * Record a value observed now.
     */
    public void record(String metric, MetricValue value) {
        record(metric, value, clock.instant());
    }

    /**
     * Record a value. Numeric values also join the metric's history; samples older than
     * the newest stored one are inserted in timestamp order and do not replace the latest value.
     */
    public void record(String metric, MetricValue value, Instant timestamp) {
        latest.merge(metric, new Observed(value, timestamp),
                (current, candidate) -> candidate.at().isBefore(current.at()) ? current : candidate);
        if (value instanceof MetricValue.NumericValue numeric) {
            Deque<MetricSample> series = history.computeIfAbsent(metric, m -> new ArrayDeque<>());
            synchronized (series) {
                MetricSample sample = new MetricSample(metric, timestamp, numeric.value());
                if (series.isEmpty() || !series.peekLast().timestamp().isAfter(timestamp)) {
                    series.addLast(sample);
                } else {
                    insertOrdered(series, sample);
                }
                while (series.size() > capacity) {
                    series.removeFirst();
                }
            }
        }
        log.trace("Recorded metric {}={}", metric, value.asText());
    }

    public void recordAll(List<MetricSample> samples) {
        for (MetricSample sample : samples) {
            record(sample.metric(), MetricValue.of(sample.value()), sample.timestamp());
        }
    }

    @Override
    public Optional<MetricValue> getMetricValue(String metric) {
        return Optional.ofNullable(latest.get(metric)).map(Observed::value);
    }

    @Override
    public List<MetricSample> getHistoricalSeries(String metric, Instant start, Instant end) {
        Deque<MetricSample> series = history.get(metric);
        if (series == null) {
            return List.of();
        }
        synchronized (series) {
            return series.stream()
                    .filter(s -> !s.timestamp().isBefore(start) && !s.timestamp().isAfter(end))
                    .toList();
        }
    }

    public Set<String> metrics() {
        return Set.copyOf(latest.keySet());
    }

    public void clear() {
        latest.clear();
        history.clear();
    }

    private record Observed(MetricValue value, Instant at) {
    }

    private static void insertOrdered(Deque<MetricSample> series, MetricSample sample) {
        Deque<MetricSample> newer = new ArrayDeque<>();
        while (!series.isEmpty() && series.peekLast().timestamp().isAfter(sample.timestamp())) {
            newer.addFirst(series.removeLast());
        }
        series.addLast(sample);
        series.addAll(newer);
    }
}
