package com.swab.backend.modules.scheduler.application;

import com.swab.backend.modules.scheduler.domain.DeliveryStatus;
import com.swab.backend.modules.scheduler.domain.NotificationDefinition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Firing handler armed once per notification. Runs on the task scheduler's threads and never throws:
 * an exception escaping a recurring task would cancel its remaining occurrences.
 */
class DeliveryTask implements Runnable {

    static final String NOTIFICATION_ID_MDC_KEY = "notificationId";
    static final int ERROR_DETAIL_MAX_LENGTH = 1000;
    private static final String UNKNOWN_ERROR = "unknown error";

    private static final Logger log = LoggerFactory.getLogger(DeliveryTask.class);

    private final NotificationDefinition definition;
    private final MessageSender messageSender;
    private final NotificationStore notificationStore;

    DeliveryTask(NotificationDefinition definition, MessageSender messageSender, NotificationStore notificationStore) {
        this.definition = definition;
        this.messageSender = messageSender;
        this.notificationStore = notificationStore;
    }

    long notificationId() {
        return definition.id();
    }

    @Override
    public void run() {
        MDC.put(NOTIFICATION_ID_MDC_KEY, String.valueOf(definition.id()));
        try {
            log.info("sending scheduled notification id={}", definition.id());
            SendResult result = send();
            if (result.success()) {
                log.info("scheduled notification sent id={}", definition.id());
                record(DeliveryStatus.SENT, null);
            } else {
                String detail = normalizeError(result.errorMessage());
                log.warn("[ALERT][Schedule] delivery failed id={} detail={}", definition.id(), detail);
                record(DeliveryStatus.FAILED, detail);
            }
        } finally {
            MDC.remove(NOTIFICATION_ID_MDC_KEY);
        }
    }

    private SendResult send() {
        try {
            return messageSender.send(definition.message());
        } catch (RuntimeException ex) {
            log.warn("message sender threw for id={}", definition.id(), ex);
            String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            return SendResult.failure(reason);
        }
    }

    private void record(DeliveryStatus status, String errorDetail) {
        try {
            notificationStore.recordDelivery(definition.id(), status, errorDetail);
        } catch (RuntimeException ex) {
            log.error("[ALERT][Schedule] failed to record delivery outcome id={} status={}",
                    definition.id(), status, ex);
        }
    }

    private String normalizeError(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN_ERROR;
        }
        if (message.length() <= ERROR_DETAIL_MAX_LENGTH) {
            return message;
        }
        return message.substring(0, ERROR_DETAIL_MAX_LENGTH);
    }
}
