package com.z254.sentinel.exception;

import com.z254.sentinel.domain.model.NotificationChannel;
import lombok.Getter;

/**
 * A notification provider failed to hand over an alert.
 */
@Getter
public class DispatchException extends SentinelException {

    private final NotificationChannel channel;

    public DispatchException(NotificationChannel channel, String message) {
        super(message);
        this.channel = channel;
    }

    public DispatchException(NotificationChannel channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }
}
