package com.z254.sentinel.domain.model;

public enum AnomalyType {
    POINT,
    CONTEXTUAL,
    COLLECTIVE,
    TREND,
    SEASONAL
}
