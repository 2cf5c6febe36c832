package com.swab.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;

public record NotificationLogResponse(
        Long id,
        Long notificationId,
        String status,
        String errorMessage,
        OffsetDateTime loggedAt
) {
}
