package com.swab.backend.modules.slack.config;

import java.time.Duration;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Slack incoming webhook settings ({@code swab.slack.*}).
 *
 * @param webhookUrl full incoming webhook URL, required
 * @param timeout    connect and read timeout of a single delivery
 */
@ConfigurationProperties(prefix = "swab.slack")
@Validated
public record SlackProperties(
        @NotBlank String webhookUrl,
        @DefaultValue("SWAB Bot") @NotBlank String username,
        @DefaultValue(":clock1:") String iconEmoji,
        @DefaultValue("10s") @NotNull Duration timeout
) {

    @AssertTrue(message = "swab.slack.timeout must be positive")
    public boolean isTimeoutPositive() {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    @AssertTrue(message = "swab.slack.webhook-url must be an http(s) URL")
    public boolean isWebhookUrlHttp() {
        // blank values are reported by @NotBlank
        return webhookUrl == null || webhookUrl.isBlank()
                || webhookUrl.startsWith("https://") || webhookUrl.startsWith("http://");
    }

    /**
     * Webhook URL safe for logs: the path carries the secret token.
     */
    public String maskedWebhookUrl() {
        if (webhookUrl == null || webhookUrl.length() <= 30) {
            return "***";
        }
        return webhookUrl.substring(0, 30) + "...";
    }
}
