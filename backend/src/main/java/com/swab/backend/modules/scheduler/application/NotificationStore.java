package com.swab.backend.modules.scheduler.application;

import java.util.List;

import com.swab.backend.modules.scheduler.domain.DeliveryStatus;
import com.swab.backend.modules.scheduler.domain.NotificationDefinition;

/**
 * Source of truth the scheduler reads definitions from and records delivery attempts to.
 */
public interface NotificationStore {

    /**
     * @return every definition currently flagged active
     * @throws NotificationStoreException when the store cannot be queried
     */
    List<NotificationDefinition> listActive();

    /**
     * Appends one delivery log entry.
     *
     * @param errorDetail failure description, {@code null} for {@link DeliveryStatus#SENT}
     * @throws NotificationStoreException when the entry cannot be written
     */
    void recordDelivery(long notificationId, DeliveryStatus status, String errorDetail);
}
