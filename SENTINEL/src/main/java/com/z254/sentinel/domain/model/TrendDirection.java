package com.z254.sentinel.domain.model;

public enum TrendDirection {
    UP,
    DOWN,
    STABLE
}
