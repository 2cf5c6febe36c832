package com.swab.backend.modules.scheduler.domain;

import java.time.ZonedDateTime;

public record ScheduledJob(long notificationId, WeeklyRecurrence recurrence, ZonedDateTime nextFireTime) {
}
