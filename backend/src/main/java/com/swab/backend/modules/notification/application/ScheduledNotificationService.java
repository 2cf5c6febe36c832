package com.swab.backend.modules.notification.application;

import java.time.LocalTime;
import java.util.List;

import com.swab.backend.global.error.ProblemException;
import com.swab.backend.modules.notification.domain.NotificationLog;
import com.swab.backend.modules.notification.domain.ScheduledNotification;
import com.swab.backend.modules.notification.infrastructure.persistence.NotificationLogRepository;
import com.swab.backend.modules.notification.infrastructure.persistence.ScheduledNotificationRepository;
import com.swab.backend.modules.scheduler.application.NotificationSchedulerEngine;
import com.swab.backend.modules.scheduler.application.NotificationStoreException;
import com.swab.backend.modules.scheduler.domain.WeeklyRecurrence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionOperations;

/**
 * CRUD over weekly notification definitions.
 * <p>
 * Every write commits first and then rebuilds the live timer set, so the scheduler always reflects
 * committed rows. When the rebuild fails the write stays committed and the caller gets
 * {@code SCHEDULER_REFRESH_FAILED}.
 */
@Service
public class ScheduledNotificationService {

    public static final int DEFAULT_LOG_LIMIT = 50;
    public static final int MAX_LOG_LIMIT = 200;

    private static final Logger log = LoggerFactory.getLogger(ScheduledNotificationService.class);

    private final ScheduledNotificationRepository notificationRepository;
    private final NotificationLogRepository notificationLogRepository;
    private final NotificationSchedulerEngine schedulerEngine;
    private final TransactionOperations transactionOperations;

    public ScheduledNotificationService(
            ScheduledNotificationRepository notificationRepository,
            NotificationLogRepository notificationLogRepository,
            NotificationSchedulerEngine schedulerEngine,
            TransactionOperations transactionOperations
    ) {
        this.notificationRepository = notificationRepository;
        this.notificationLogRepository = notificationLogRepository;
        this.schedulerEngine = schedulerEngine;
        this.transactionOperations = transactionOperations;
    }

    @Transactional(readOnly = true)
    public List<ScheduledNotification> list(Boolean active, Integer dayOfWeek) {
        if (dayOfWeek != null) {
            requireDayInRange(dayOfWeek);
            return active == null
                    ? notificationRepository.findByDayOfWeekOrderByIdAsc(dayOfWeek)
                    : notificationRepository.findByDayOfWeekAndActiveOrderByIdAsc(dayOfWeek, active);
        }
        return active == null
                ? notificationRepository.findAllByOrderByIdAsc()
                : notificationRepository.findByActiveOrderByIdAsc(active);
    }

    @Transactional(readOnly = true)
    public ScheduledNotification get(long id) {
        return findOrThrow(id);
    }

    public ScheduledNotification create(String message, int dayOfWeek, String time, Boolean active) {
        WeeklyRecurrence recurrence = toRecurrence(dayOfWeek, time);
        String text = requireMessage(message);

        ScheduledNotification saved = transactionOperations.execute(status -> {
            ScheduledNotification notification = new ScheduledNotification();
            notification.setMessage(text);
            notification.setDayOfWeek(recurrence.dayOfWeek());
            notification.setSendTime(recurrence.time());
            notification.setActive(active == null || active);
            return notificationRepository.save(notification);
        });
        log.info("created notification id={} schedule={}", saved.getId(), recurrence.describe());
        refreshSchedule();
        return saved;
    }

    /**
     * Applies the non-null fields. The resulting day and time are validated together.
     */
    public ScheduledNotification update(long id, String message, Integer dayOfWeek, String time, Boolean active) {
        String text = message != null ? requireMessage(message) : null;

        ScheduledNotification updated = transactionOperations.execute(status -> {
            ScheduledNotification notification = findOrThrow(id);
            int nextDay = dayOfWeek != null ? dayOfWeek : notification.getDayOfWeek();
            WeeklyRecurrence recurrence = time != null
                    ? toRecurrence(nextDay, time)
                    : toRecurrence(nextDay, notification.getSendTime());
            if (text != null) {
                notification.setMessage(text);
            }
            notification.setDayOfWeek(recurrence.dayOfWeek());
            notification.setSendTime(recurrence.time());
            if (active != null) {
                notification.setActive(active);
            }
            return notificationRepository.saveAndFlush(notification);
        });
        log.info("updated notification id={}", id);
        refreshSchedule();
        return updated;
    }

    public void delete(long id) {
        transactionOperations.executeWithoutResult(status -> {
            ScheduledNotification notification = findOrThrow(id);
            notificationRepository.delete(notification);
        });
        log.info("deleted notification id={}", id);
        refreshSchedule();
    }

    public ScheduledNotification toggle(long id) {
        ScheduledNotification toggled = transactionOperations.execute(status -> {
            ScheduledNotification notification = findOrThrow(id);
            notification.toggleActive();
            return notificationRepository.saveAndFlush(notification);
        });
        log.info("toggled notification id={} active={}", id, toggled.isActive());
        refreshSchedule();
        return toggled;
    }

    /**
     * Newest first. Works for ids whose definition has been deleted.
     */
    @Transactional(readOnly = true)
    public List<NotificationLog> listLogs(long id, Integer limit) {
        int size = limit == null ? DEFAULT_LOG_LIMIT : Math.min(Math.max(limit, 1), MAX_LOG_LIMIT);
        return notificationLogRepository.findByNotificationIdOrderByLoggedAtDescIdDesc(id, PageRequest.of(0, size));
    }

    private void refreshSchedule() {
        try {
            schedulerEngine.rearmAll();
        } catch (NotificationStoreException ex) {
            throw new ProblemException(
                    HttpStatus.INTERNAL_SERVER_ERROR,
                    "SCHEDULER_REFRESH_FAILED",
                    "The change was saved but the schedule could not be refreshed",
                    ex
            );
        }
    }

    private ScheduledNotification findOrThrow(long id) {
        return notificationRepository.findById(id)
                .orElseThrow(() -> ProblemException.notFound("NOTIFICATION_NOT_FOUND"));
    }

    private static String requireMessage(String message) {
        if (message == null || message.isBlank()) {
            throw ProblemException.badRequest("MESSAGE_REQUIRED", "message must not be blank");
        }
        return message;
    }

    private static void requireDayInRange(int dayOfWeek) {
        if (dayOfWeek < WeeklyRecurrence.SUNDAY || dayOfWeek > WeeklyRecurrence.SATURDAY) {
            throw ProblemException.badRequest("DAY_OF_WEEK_OUT_OF_RANGE", "dayOfWeek must be between 0 and 6");
        }
    }

    private static WeeklyRecurrence toRecurrence(int dayOfWeek, String time) {
        requireDayInRange(dayOfWeek);
        try {
            return WeeklyRecurrence.parse(dayOfWeek, time);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("TIME_FORMAT_INVALID", "time must use HH:MM (24-hour)");
        }
    }

    private static WeeklyRecurrence toRecurrence(int dayOfWeek, LocalTime time) {
        requireDayInRange(dayOfWeek);
        return WeeklyRecurrence.of(dayOfWeek, time);
    }
}
