package com.swab.backend.modules.notification.domain;

import java.time.LocalTime;

import com.swab.backend.global.jpa.AbstractTimestampedEntity;
import com.swab.backend.modules.scheduler.domain.NotificationDefinition;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "notifications")
public class ScheduledNotification extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "message", nullable = false, length = 4000)
    private String message;

    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "send_time", nullable = false)
    private LocalTime sendTime;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    public Long getId() {
        return id;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public int getDayOfWeek() {
        return dayOfWeek;
    }

    public void setDayOfWeek(int dayOfWeek) {
        this.dayOfWeek = dayOfWeek;
    }

    public LocalTime getSendTime() {
        return sendTime;
    }

    public void setSendTime(LocalTime sendTime) {
        this.sendTime = sendTime;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public void toggleActive() {
        this.active = !this.active;
    }

    public NotificationDefinition toDefinition() {
        return new NotificationDefinition(id, message, dayOfWeek, sendTime, active);
    }
}
