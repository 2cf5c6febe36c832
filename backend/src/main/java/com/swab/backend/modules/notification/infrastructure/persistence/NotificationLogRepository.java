package com.swab.backend.modules.notification.infrastructure.persistence;

import java.util.List;

import com.swab.backend.modules.notification.domain.NotificationLog;
import com.swab.backend.modules.scheduler.domain.DeliveryStatus;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationLogRepository extends JpaRepository<NotificationLog, Long> {

    long countByStatus(DeliveryStatus status);

    List<NotificationLog> findByNotificationIdOrderByLoggedAtDescIdDesc(Long notificationId, Pageable pageable);

    List<NotificationLog> findByNotificationId(Long notificationId);
}
