package com.z254.sentinel.domain.model;

public enum NotificationStatus {
    PENDING,
    SENT,
    FAILED,
    DELIVERED
}
