package com.z254.sentinel.domain.model;

/**
 * Detection algorithms a detector can be configured with.
 */
public enum AnomalyAlgorithm {
    /** Z-score, IQR and modified Z-score votes over the training window */
    STATISTICAL,
    /** Seasonal decomposition with statistical fallback */
    SEASONAL_HYBRID
}
