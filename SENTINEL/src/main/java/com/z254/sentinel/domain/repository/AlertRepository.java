package com.z254.sentinel.domain.repository;

import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.AlertFilter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for alert persistence.
 */
public interface AlertRepository {

    /**
     * Persist the given alert. Existing alerts are replaced.
     */
    Alert save(Alert alert);

    Optional<Alert> findById(String id);

    /**
     * Alerts matching the filter, newest first.
     */
    List<Alert> find(AlertFilter filter);

    List<Alert> findAll();

    /**
     * Remove alerts resolved before {@code cutoff}.
     *
     * @return number of alerts removed
     */
    int deleteResolvedBefore(Instant cutoff);
}
