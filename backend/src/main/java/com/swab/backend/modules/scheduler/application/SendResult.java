package com.swab.backend.modules.scheduler.application;

public record SendResult(boolean success, String errorMessage) {

    private static final SendResult DELIVERED = new SendResult(true, null);

    public static SendResult delivered() {
        return DELIVERED;
    }

    public static SendResult failure(String errorMessage) {
        return new SendResult(false, errorMessage);
    }
}
