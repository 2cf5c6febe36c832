package com.swab.backend.modules.scheduler.domain;

public enum DeliveryStatus {
    SENT,
    FAILED
}
