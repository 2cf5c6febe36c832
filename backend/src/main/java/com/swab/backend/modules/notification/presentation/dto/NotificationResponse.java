package com.swab.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;

public record NotificationResponse(
        Long id,
        String message,
        int dayOfWeek,
        String dayName,
        String time,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
