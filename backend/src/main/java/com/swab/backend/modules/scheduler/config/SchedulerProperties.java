package com.swab.backend.modules.scheduler.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the weekly notification scheduler ({@code swab.scheduler.*}).
 *
 * @param poolSize           threads available to concurrent firings
 * @param failOnStartupError abort startup when active notifications cannot be loaded
 * @param probeText          text sent by connectivity probes
 */
@ConfigurationProperties(prefix = "swab.scheduler")
@Validated
public record SchedulerProperties(
        @DefaultValue("4") @Positive int poolSize,
        @DefaultValue("true") boolean failOnStartupError,
        @DefaultValue("Test message from SWAB Server! :rocket:") @NotBlank String probeText
) {
}
