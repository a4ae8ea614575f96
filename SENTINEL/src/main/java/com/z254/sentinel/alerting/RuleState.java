package com.z254.sentinel.alerting;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Evaluation state of one rule. Callers hold the instance's monitor for every read-modify-write.
 */
public class RuleState {

    private Instant conditionStartTime;
    private Instant lastAlertTime;
    private final Deque<Instant> recentFireTimes = new ArrayDeque<>();

    public synchronized Instant getConditionStartTime() {
        return conditionStartTime;
    }

    public synchronized Instant getLastAlertTime() {
        return lastAlertTime;
    }

    /**
     * Mark the condition as holding from {@code now} unless it already is.
     *
     * @return the instant the condition started holding
     */
    synchronized Instant conditionObserved(Instant now) {
        if (conditionStartTime == null) {
            conditionStartTime = now;
        }
        return conditionStartTime;
    }

    synchronized void conditionCleared() {
        conditionStartTime = null;
    }

    /**
     * Reserve a fire slot: succeeds when the cooldown since the last alert has elapsed and fewer
     * than {@code maxAlerts} fires happened within {@code window} before {@code now}.
     */
    synchronized boolean tryReserve(Instant now, Duration cooldown, int maxAlerts, Duration window) {
        if (lastAlertTime != null && Duration.between(lastAlertTime, now).compareTo(cooldown) < 0) {
            return false;
        }
        Instant windowStart = now.minus(window);
        while (!recentFireTimes.isEmpty() && recentFireTimes.peekFirst().isBefore(windowStart)) {
            recentFireTimes.removeFirst();
        }
        if (recentFireTimes.size() >= maxAlerts) {
            return false;
        }
        lastAlertTime = now;
        recentFireTimes.addLast(now);
        return true;
    }

    public synchronized int recentFireCount() {
        return recentFireTimes.size();
    }
}
