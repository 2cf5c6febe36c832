package com.swab.backend.modules.scheduler.application;

import com.swab.backend.modules.scheduler.config.SchedulerProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Arms the weekly timers while the context starts, before the web server opens its port,
 * and stops them when the context closes.
 */
@Component
@ConditionalOnProperty(name = "swab.scheduler.auto-start", havingValue = "true", matchIfMissing = true)
public class NotificationSchedulerLifecycle implements SmartLifecycle {

    // lower phases start first; the embedded web server starts near Integer.MAX_VALUE
    static final int PHASE = 0;

    private static final Logger log = LoggerFactory.getLogger(NotificationSchedulerLifecycle.class);

    private final NotificationSchedulerEngine engine;
    private final SchedulerProperties properties;
    private volatile boolean running;

    public NotificationSchedulerLifecycle(NotificationSchedulerEngine engine, SchedulerProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @Override
    public void start() {
        try {
            int armed = engine.initializeAll();
            log.info("notification scheduler started with {} active jobs", armed);
        } catch (NotificationStoreException ex) {
            if (properties.failOnStartupError()) {
                throw new IllegalStateException("Failed to initialize notification scheduler", ex);
            }
            log.warn("notification scheduler started without jobs; use POST /scheduler/refresh once the store is back");
        }
        running = true;
    }

    @Override
    public void stop() {
        engine.disarmAll();
        running = false;
        log.info("notification scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
