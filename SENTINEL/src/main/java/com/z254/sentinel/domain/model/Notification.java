package com.z254.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Record of one send attempt to one channel.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    private String id;

    private NotificationChannel channel;

    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    private Instant sentAt;

    @Builder.Default
    private NotificationStatus status = NotificationStatus.PENDING;

    private String error;

    private int escalationLevel;

    private int retryCount;
}
