package com.z254.sentinel.exception;

import com.z254.sentinel.domain.model.AlertStatus;
import lombok.Getter;

/**
 * Requested status change is not allowed from the alert's current status.
 */
@Getter
public class AlertTransitionException extends SentinelException {

    private final String alertId;
    private final AlertStatus from;
    private final AlertStatus to;

    public AlertTransitionException(String alertId, AlertStatus from, AlertStatus to) {
        super("Alert " + alertId + " cannot move from " + from + " to " + to);
        this.alertId = alertId;
        this.from = from;
        this.to = to;
    }
}
