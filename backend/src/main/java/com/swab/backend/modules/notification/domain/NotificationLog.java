package com.swab.backend.modules.notification.domain;

import java.time.OffsetDateTime;

import com.swab.backend.modules.scheduler.domain.DeliveryStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * One delivery attempt. The notification id is a plain column: log rows outlive deleted notifications.
 */
@Entity
@Table(name = "notification_logs")
public class NotificationLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "message_id", nullable = false, updatable = false)
    private Long notificationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16, updatable = false)
    private DeliveryStatus status;

    @Column(name = "error_message", length = 1000, updatable = false)
    private String errorMessage;

    @Column(name = "sent_at", nullable = false, updatable = false)
    private OffsetDateTime loggedAt;

    protected NotificationLog() {
    }

    public NotificationLog(Long notificationId, DeliveryStatus status, String errorMessage, OffsetDateTime loggedAt) {
        this.notificationId = notificationId;
        this.status = status;
        this.errorMessage = errorMessage;
        this.loggedAt = loggedAt;
    }

    public Long getId() {
        return id;
    }

    public Long getNotificationId() {
        return notificationId;
    }

    public DeliveryStatus getStatus() {
        return status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public OffsetDateTime getLoggedAt() {
        return loggedAt;
    }
}
