package com.swab.backend.modules.scheduler.domain;

/**
 * Rearm protocol states. {@code LOADING} lasts while active definitions are fetched;
 * a failed fetch ends in {@code EMPTY} with no timers armed.
 */
public enum SchedulerState {
    EMPTY,
    LOADING,
    ARMED
}
