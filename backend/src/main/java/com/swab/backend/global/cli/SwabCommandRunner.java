package com.swab.backend.global.cli;

import com.swab.backend.modules.scheduler.application.MessageDeliveryException;
import com.swab.backend.modules.scheduler.application.NotificationSchedulerEngine;
import com.swab.backend.modules.scheduler.application.NotificationStoreException;
import com.swab.backend.modules.scheduler.config.SchedulerProperties;
import com.swab.backend.modules.slack.config.SlackProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Executes the one-shot command line modes. The exit code is picked up by {@code SpringApplication.exit}.
 */
@Component
public class SwabCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(SwabCommandRunner.class);

    private final NotificationSchedulerEngine engine;
    private final SchedulerProperties schedulerProperties;
    private final SlackProperties slackProperties;

    private volatile int exitCode;

    public SwabCommandRunner(
            NotificationSchedulerEngine engine,
            SchedulerProperties schedulerProperties,
            SlackProperties slackProperties
    ) {
        this.engine = engine;
        this.schedulerProperties = schedulerProperties;
        this.slackProperties = slackProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        SwabCommand command = SwabCommand.resolve(args.getSourceArgs());
        exitCode = switch (command) {
            case SERVE -> 0;
            case TEST -> sendTestMessage();
            case VALIDATE_WEBHOOK -> validateWebhook();
            case REFRESH -> refresh();
        };
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int sendTestMessage() {
        log.info("sending test message to {}", slackProperties.maskedWebhookUrl());
        try {
            engine.sendProbe(schedulerProperties.probeText());
            log.info("test message sent successfully");
            return 0;
        } catch (MessageDeliveryException ex) {
            log.error("test message failed: {}", ex.getMessage());
            return 1;
        }
    }

    private int validateWebhook() {
        log.info("validating webhook {}", slackProperties.maskedWebhookUrl());
        try {
            engine.sendProbe(schedulerProperties.probeText());
            log.info("webhook is valid");
        } catch (MessageDeliveryException ex) {
            log.warn("webhook is invalid: {}", ex.getMessage());
        }
        return 0;
    }

    /**
     * Loads and arms the active definitions inside this one-shot process, which checks that the store is
     * readable and every definition can be scheduled. A running server keeps its own timers; it is refreshed
     * through {@code POST /scheduler/refresh}.
     */
    private int refresh() {
        try {
            int armed = engine.rearmAll();
            log.info("schedule check passed, {} notifications can be armed "
                    + "(a running server is not affected; use POST /scheduler/refresh)", armed);
            return 0;
        } catch (NotificationStoreException ex) {
            log.error("schedule check failed: {}", ex.getMessage());
            return 1;
        }
    }
}
