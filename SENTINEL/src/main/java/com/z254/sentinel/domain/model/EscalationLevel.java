package com.z254.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One step of an escalation policy. Levels are numbered from 1.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationLevel {

    private int level;

    /** Minutes spent at this level before moving to the next one */
    private int timeout;

    @Builder.Default
    private List<NotificationChannel> channels = new ArrayList<>();

    @Builder.Default
    private Map<NotificationChannel, List<String>> recipients = new HashMap<>();

    /** Minutes between repeated notifications at this level, 0 = no repeat */
    private Integer repeatInterval;

    private Integer maxRepeats;

    public boolean repeats() {
        return repeatInterval != null && repeatInterval > 0;
    }
}
