package com.z254.sentinel.domain.model;

/**
 * Delivery channels. Each channel is served by at most one provider.
 */
public enum NotificationChannel {
    EMAIL,
    SLACK,
    WEBHOOK,
    PAGERDUTY
}
