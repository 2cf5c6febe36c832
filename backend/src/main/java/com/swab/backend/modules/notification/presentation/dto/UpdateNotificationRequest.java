package com.swab.backend.modules.notification.presentation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update: {@code null} fields are left unchanged.
 */
public record UpdateNotificationRequest(
        @Size(max = 4000, message = "MESSAGE_TOO_LONG")
        String message,
        @Min(value = 0, message = "DAY_OF_WEEK_OUT_OF_RANGE")
        @Max(value = 6, message = "DAY_OF_WEEK_OUT_OF_RANGE")
        Integer dayOfWeek,
        @Pattern(regexp = NotificationTimeFormat.PATTERN, message = "TIME_FORMAT_INVALID")
        String time,
        Boolean active
) {
}
