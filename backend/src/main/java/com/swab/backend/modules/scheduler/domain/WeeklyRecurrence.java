package com.swab.backend.modules.scheduler.domain;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.TextStyle;
import java.util.Locale;

import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

/**
 * "Every week on {@code dayOfWeek} at {@code hour:minute}".
 * <p>
 * Day numbering follows the stored notification definitions: {@code 0} is Sunday and {@code 6} is Saturday.
 * The value is validated on construction and rendered to Spring's six-field cron grammar on demand,
 * so callers never build cron strings themselves.
 */
public record WeeklyRecurrence(int minute, int hour, int dayOfWeek) {

    public static final int SUNDAY = 0;
    public static final int SATURDAY = 6;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    public WeeklyRecurrence {
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("minute must be between 0 and 59: " + minute);
        }
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be between 0 and 23: " + hour);
        }
        if (dayOfWeek < SUNDAY || dayOfWeek > SATURDAY) {
            throw new IllegalArgumentException("dayOfWeek must be between 0 (Sunday) and 6 (Saturday): " + dayOfWeek);
        }
    }

    public static WeeklyRecurrence of(int dayOfWeek, LocalTime time) {
        if (time == null) {
            throw new IllegalArgumentException("time is required");
        }
        return new WeeklyRecurrence(time.getMinute(), time.getHour(), dayOfWeek);
    }

    /**
     * Parses a strict 24-hour {@code HH:MM} wall-clock time.
     */
    public static WeeklyRecurrence parse(int dayOfWeek, String time) {
        if (time == null) {
            throw new IllegalArgumentException("time is required");
        }
        try {
            return of(dayOfWeek, LocalTime.parse(time.trim(), TIME_FORMAT));
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("time must use HH:MM (24-hour): " + time, ex);
        }
    }

    public DayOfWeek day() {
        return dayOfWeek == SUNDAY ? DayOfWeek.SUNDAY : DayOfWeek.of(dayOfWeek);
    }

    public LocalTime time() {
        return LocalTime.of(hour, minute);
    }

    public String toCronExpression() {
        return "0 %d %d * * %s".formatted(minute, hour, day().name().substring(0, 3));
    }

    public CronTrigger toTrigger(ZoneId zone) {
        return new CronTrigger(toCronExpression(), zone);
    }

    /**
     * Returns the first occurrence strictly after {@code instant}, in the instant's zone.
     */
    public ZonedDateTime nextOccurrenceAfter(ZonedDateTime instant) {
        return CronExpression.parse(toCronExpression()).next(instant);
    }

    public String describe() {
        return day().getDisplayName(TextStyle.FULL, Locale.ENGLISH) + " at " + time().format(TIME_FORMAT);
    }
}
