package com.z254.sentinel.domain.repository;

import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.AlertFilter;
import com.z254.sentinel.domain.model.AlertStatus;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory alert store. Alerts are mutable and guarded by their own monitor, so the
 * store only hands out the shared instances.
 */
@Repository
public class InMemoryAlertRepository implements AlertRepository {

    private final Map<String, Alert> store = new ConcurrentHashMap<>();

    @Override
    public Alert save(Alert alert) {
        store.put(alert.getId(), alert);
        return alert;
    }

    @Override
    public Optional<Alert> findById(String id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public List<Alert> find(AlertFilter filter) {
        return store.values().stream()
                .filter(filter::matches)
                .sorted(Comparator.comparing(Alert::getTimestamp).reversed())
                .toList();
    }

    @Override
    public List<Alert> findAll() {
        return new ArrayList<>(store.values());
    }

    @Override
    public int deleteResolvedBefore(Instant cutoff) {
        int removed = 0;
        for (Alert alert : store.values()) {
            boolean expired;
            synchronized (alert) {
                expired = alert.getStatus() == AlertStatus.RESOLVED
                        && alert.getResolvedAt() != null
                        && alert.getResolvedAt().isBefore(cutoff);
            }
            if (expired && store.remove(alert.getId(), alert)) {
                removed++;
            }
        }
        return removed;
    }
}
