package com.swab.backend.modules.scheduler.presentation.dto;

import java.time.OffsetDateTime;

public record ScheduledJobResponse(
        long notificationId,
        String schedule,
        String cronExpression,
        OffsetDateTime nextFireTime
) {
}
