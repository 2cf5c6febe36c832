package com.swab.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the single timezone the service schedules in, and a clock bound to it,
 * so weekly notifications and delivery log timestamps share one time source.
 */
@Configuration
public class TimeConfig {

    @Bean
    public ZoneId applicationZone(@Value("${swab.time-zone:UTC}") String zone) {
        return ZoneId.of(zone);
    }

    @Bean
    public Clock applicationClock(ZoneId applicationZone) {
        return Clock.system(applicationZone);
    }
}
