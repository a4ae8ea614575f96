package com.z254.sentinel.domain.repository;

import com.z254.sentinel.domain.model.Anomaly;
import com.z254.sentinel.domain.model.AnomalyFilter;

import java.util.List;

/**
 * Append-only anomaly log, partitioned by detector.
 */
public interface AnomalyRepository {

    /**
     * Append an anomaly to its detector's log, evicting the oldest entry when the log is full.
     */
    Anomaly append(Anomaly anomaly);

    /**
     * Anomalies matching the filter, newest first.
     */
    List<Anomaly> find(AnomalyFilter filter);

    List<Anomaly> findByDetector(String detectorId);

    /**
     * Drop a detector's log.
     */
    void deleteByDetector(String detectorId);

    long count();
}
