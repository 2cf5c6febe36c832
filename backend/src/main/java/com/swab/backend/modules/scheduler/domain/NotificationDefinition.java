package com.swab.backend.modules.scheduler.domain;

import java.time.LocalTime;

/**
 * Read-only view of a stored notification, as the scheduler needs it.
 */
public record NotificationDefinition(long id, String message, int dayOfWeek, LocalTime time, boolean active) {

    public WeeklyRecurrence recurrence() {
        return WeeklyRecurrence.of(dayOfWeek, time);
    }
}
