package com.swab.backend.modules.scheduler.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfig {

    static final String THREAD_NAME_PREFIX = "swab-notify-";

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public ThreadPoolTaskScheduler notificationTaskScheduler(SchedulerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.poolSize());
        scheduler.setThreadNamePrefix(THREAD_NAME_PREFIX);
        // cancelled weekly timers must not linger in the queue until their next occurrence
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(ex -> log.error("[ALERT][Schedule] uncaught error in scheduled task", ex));
        return scheduler;
    }
}
