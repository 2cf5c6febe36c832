package com.swab.backend.modules.scheduler.application;

public class MessageDeliveryException extends RuntimeException {

    public MessageDeliveryException(String message) {
        super(message);
    }
}
