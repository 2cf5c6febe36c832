package com.swab.backend.modules.notification.infrastructure.persistence;

import java.util.List;

import com.swab.backend.modules.notification.domain.ScheduledNotification;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ScheduledNotificationRepository extends JpaRepository<ScheduledNotification, Long> {

    List<ScheduledNotification> findAllByOrderByIdAsc();

    List<ScheduledNotification> findByActiveOrderByIdAsc(boolean active);

    List<ScheduledNotification> findByDayOfWeekOrderByIdAsc(int dayOfWeek);

    List<ScheduledNotification> findByDayOfWeekAndActiveOrderByIdAsc(int dayOfWeek, boolean active);
}
