package com.swab.backend.modules.notification.infrastructure;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import com.swab.backend.modules.notification.domain.NotificationLog;
import com.swab.backend.modules.notification.domain.ScheduledNotification;
import com.swab.backend.modules.notification.infrastructure.persistence.NotificationLogRepository;
import com.swab.backend.modules.notification.infrastructure.persistence.ScheduledNotificationRepository;
import com.swab.backend.modules.scheduler.application.NotificationStore;
import com.swab.backend.modules.scheduler.application.NotificationStoreException;
import com.swab.backend.modules.scheduler.domain.DeliveryStatus;
import com.swab.backend.modules.scheduler.domain.NotificationDefinition;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

@Component
public class JpaNotificationStore implements NotificationStore {

    private final ScheduledNotificationRepository scheduledNotificationRepository;
    private final NotificationLogRepository notificationLogRepository;
    private final Clock clock;

    public JpaNotificationStore(
            ScheduledNotificationRepository scheduledNotificationRepository,
            NotificationLogRepository notificationLogRepository,
            Clock clock
    ) {
        this.scheduledNotificationRepository = scheduledNotificationRepository;
        this.notificationLogRepository = notificationLogRepository;
        this.clock = clock;
    }

    @Override
    public List<NotificationDefinition> listActive() {
        try {
            return scheduledNotificationRepository.findByActiveOrderByIdAsc(true).stream()
                    .map(ScheduledNotification::toDefinition)
                    .toList();
        } catch (DataAccessException | TransactionException ex) {
            throw new NotificationStoreException("Failed to fetch active notifications", ex);
        }
    }

    @Override
    public void recordDelivery(long notificationId, DeliveryStatus status, String errorDetail) {
        NotificationLog entry = new NotificationLog(
                notificationId,
                status,
                status == DeliveryStatus.FAILED ? errorDetail : null,
                OffsetDateTime.now(clock)
        );
        try {
            notificationLogRepository.save(entry);
        } catch (DataAccessException | TransactionException ex) {
            throw new NotificationStoreException("Failed to record delivery for notification " + notificationId, ex);
        }
    }
}
