package com.swab.backend.modules.scheduler.application;

public class NotificationStoreException extends RuntimeException {

    public NotificationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
