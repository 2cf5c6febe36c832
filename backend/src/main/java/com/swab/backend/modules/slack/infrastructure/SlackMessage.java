package com.swab.backend.modules.slack.infrastructure;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Incoming webhook payload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlackMessage(
        String text,
        String username,
        @JsonProperty("icon_emoji") String iconEmoji
) {
}
