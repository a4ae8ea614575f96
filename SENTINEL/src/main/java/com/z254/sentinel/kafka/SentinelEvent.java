package com.z254.sentinel.kafka;

import java.time.Instant;

/**
 * Envelope of the JSON events published for anomalies and alert transitions.
 *
 * @param eventId   unique id of this event
 * @param eventType {@code ANOMALY_DETECTED} or an alert transition such as {@code ALERT_CREATED}
 * @param entityId  anomaly or alert id, also used as the record key
 * @param timestamp when the event was emitted
 * @param payload   the anomaly or alert document
 */
public record SentinelEvent(
        String eventId,
        String eventType,
        String entityId,
        Instant timestamp,
        Object payload
) {
}
