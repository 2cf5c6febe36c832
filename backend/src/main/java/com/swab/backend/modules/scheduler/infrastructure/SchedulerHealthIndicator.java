package com.swab.backend.modules.scheduler.infrastructure;

import com.swab.backend.modules.scheduler.application.NotificationSchedulerEngine;
import com.swab.backend.modules.scheduler.domain.SchedulerState;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reported as {@code notificationScheduler} in the actuator health tree.
 */
@Component("notificationScheduler")
public class SchedulerHealthIndicator implements HealthIndicator {

    private final NotificationSchedulerEngine engine;

    public SchedulerHealthIndicator(NotificationSchedulerEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        SchedulerState state = engine.state();
        Health.Builder builder = state == SchedulerState.EMPTY ? Health.down() : Health.up();
        return builder
                .withDetail("state", state.name())
                .withDetail("scheduledJobs", engine.count())
                .build();
    }
}
