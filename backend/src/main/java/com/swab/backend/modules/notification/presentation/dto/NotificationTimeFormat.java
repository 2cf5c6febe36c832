package com.swab.backend.modules.notification.presentation.dto;

import java.time.format.DateTimeFormatter;

public final class NotificationTimeFormat {

    /** 24-hour {@code HH:MM}. */
    public static final String PATTERN = "^([01]\\d|2[0-3]):[0-5]\\d$";

    public static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("HH:mm");

    private NotificationTimeFormat() {
    }
}
