package com.z254.sentinel.domain.model;

/**
 * Alert lifecycle states.
 * <p>
 * Allowed transitions: OPEN to ACKNOWLEDGED, RESOLVED or SUPPRESSED;
 * ACKNOWLEDGED and SUPPRESSED to RESOLVED.
 */
public enum AlertStatus {
    OPEN,
    ACKNOWLEDGED,
    RESOLVED,
    SUPPRESSED
}
