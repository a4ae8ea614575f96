package com.z254.sentinel.alerting;

import com.z254.sentinel.domain.model.AlertRule;
import org.springframework.stereotype.Component;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Decides whether a rule's schedule allows evaluation at a given instant.
 * <p>
 * A rule is skipped during any of its maintenance windows (both ends inclusive) and, when business
 * hours are configured, outside them. Business hours are read in the schedule's time zone with
 * days numbered 0 (Sunday) to 6 and an inclusive {@code HH:mm} end.
 */
@Component
public class ScheduleWindow {

    static final DateTimeFormatter HOURS_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    public boolean isActive(AlertRule.Schedule schedule, Instant now) {
        return inactiveReason(schedule, now).isEmpty();
    }

    /**
     * Why the schedule blocks evaluation at {@code now}, or empty when it does not.
     */
    public Optional<String> inactiveReason(AlertRule.Schedule schedule, Instant now) {
        if (schedule == null || !schedule.isEnabled()) {
            return Optional.empty();
        }

        Optional<AlertRule.MaintenanceWindow> maintenance = activeMaintenanceWindow(schedule, now);
        if (maintenance.isPresent()) {
            String reason = maintenance.get().getReason();
            return Optional.of("In maintenance window" + (reason != null ? ": " + reason : ""));
        }

        AlertRule.BusinessHours hours = schedule.getBusinessHours();
        if (hours != null && !isBusinessHours(hours, now.atZone(zone(schedule)))) {
            return Optional.of("Outside business hours");
        }

        return Optional.empty();
    }

    public Optional<AlertRule.MaintenanceWindow> activeMaintenanceWindow(AlertRule.Schedule schedule, Instant now) {
        if (schedule.getMaintenanceWindows() == null) {
            return Optional.empty();
        }
        return schedule.getMaintenanceWindows().stream()
                .filter(w -> !now.isBefore(w.getStart()) && !now.isAfter(w.getEnd()))
                .findFirst();
    }

    // ========== Private Methods ==========

    private boolean isBusinessHours(AlertRule.BusinessHours hours, ZonedDateTime time) {
        int dayOfWeek = time.getDayOfWeek().getValue() % 7;
        if (hours.getDays() == null || !hours.getDays().contains(dayOfWeek)) {
            return false;
        }
        LocalTime minute = time.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
        LocalTime start = LocalTime.parse(hours.getStart(), HOURS_FORMAT);
        LocalTime end = LocalTime.parse(hours.getEnd(), HOURS_FORMAT);
        return !minute.isBefore(start) && !minute.isAfter(end);
    }

    private static ZoneId zone(AlertRule.Schedule schedule) {
        return schedule.getTimezone() == null ? ZoneOffset.UTC : ZoneId.of(schedule.getTimezone());
    }
}
