package com.z254.sentinel.domain.repository;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.Anomaly;
import com.z254.sentinel.domain.model.AnomalyFilter;
import org.springframework.stereotype.Repository;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded in-memory anomaly log. Each detector keeps at most
 * {@code sentinel.detection.anomaly-log-capacity} entries.
 */
@Repository
public class InMemoryAnomalyRepository implements AnomalyRepository {

    private final Map<String, Deque<Anomaly>> logs = new ConcurrentHashMap<>();
    private final int capacity;

    public InMemoryAnomalyRepository(SentinelProperties properties) {
        this.capacity = properties.getDetection().getAnomalyLogCapacity();
    }

    @Override
    public Anomaly append(Anomaly anomaly) {
        Deque<Anomaly> log = logs.computeIfAbsent(anomaly.getDetectorId(), id -> new ArrayDeque<>());
        synchronized (log) {
            log.addLast(anomaly);
            while (log.size() > capacity) {
                log.removeFirst();
            }
        }
        return anomaly;
    }

    @Override
    public List<Anomaly> find(AnomalyFilter filter) {
        List<Anomaly> result = new ArrayList<>();
        for (Deque<Anomaly> log : logs.values()) {
            synchronized (log) {
                log.stream().filter(filter::matches).forEach(result::add);
            }
        }
        result.sort(Comparator.comparing(Anomaly::getTimestamp).reversed());
        return result;
    }

    @Override
    public List<Anomaly> findByDetector(String detectorId) {
        Deque<Anomaly> log = logs.get(detectorId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            return new ArrayList<>(log);
        }
    }

    @Override
    public void deleteByDetector(String detectorId) {
        logs.remove(detectorId);
    }

    @Override
    public long count() {
        long total = 0;
        for (Deque<Anomaly> log : logs.values()) {
            synchronized (log) {
                total += log.size();
            }
        }
        return total;
    }
}
