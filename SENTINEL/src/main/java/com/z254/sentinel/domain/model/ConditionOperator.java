package com.z254.sentinel.domain.model;

/**
 * Comparison applied between a metric value and a rule threshold.
 */
public enum ConditionOperator {
    GT,
    GTE,
    LT,
    LTE,
    EQ,
    NEQ,
    CONTAINS,
    NOT_CONTAINS,
    REGEX;

    public boolean isNumeric() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }
}
