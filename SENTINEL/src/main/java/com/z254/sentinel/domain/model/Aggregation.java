package com.z254.sentinel.domain.model;

/**
 * Reduction applied to the samples of a condition's time window.
 */
public enum Aggregation {
    AVG,
    SUM,
    MIN,
    MAX,
    COUNT,
    /** Change per minute between the first and last sample of the window */
    RATE
}
