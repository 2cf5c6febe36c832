package com.swab.backend.modules.slack.infrastructure;

import java.net.URI;

import com.swab.backend.modules.scheduler.application.MessageSender;
import com.swab.backend.modules.scheduler.application.SendResult;
import com.swab.backend.modules.slack.config.SlackProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Posts messages to a Slack incoming webhook. A new Slack message is created on every call.
 */
@Component
public class SlackWebhookSender implements MessageSender {

    private static final Logger log = LoggerFactory.getLogger(SlackWebhookSender.class);
    private static final int MAX_BODY_IN_ERROR = 200;

    private final RestClient slackRestClient;
    private final SlackProperties properties;
    private final URI webhookUri;

    public SlackWebhookSender(RestClient slackRestClient, SlackProperties properties) {
        this.slackRestClient = slackRestClient;
        this.properties = properties;
        this.webhookUri = URI.create(properties.webhookUrl());
        log.info("Slack webhook configured: {}", properties.maskedWebhookUrl());
    }

    @Override
    public SendResult send(String text) {
        SlackMessage payload = new SlackMessage(text, properties.username(), properties.iconEmoji());
        try {
            ResponseEntity<String> response = slackRestClient.post()
                    .uri(webhookUri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .toEntity(String.class);
            log.debug("Slack response status={} body={}", response.getStatusCode().value(), response.getBody());
            return SendResult.delivered();
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            if (status == HttpStatus.NOT_FOUND.value()) {
                log.error("Slack webhook not found (404). Check that the webhook URL is correct, "
                        + "the Slack app is still installed and the webhook has not been revoked");
            }
            String reason = "Slack responded " + status + ": " + abbreviate(ex.getResponseBodyAsString());
            log.warn("Slack delivery failed: {}", reason);
            return SendResult.failure(reason);
        } catch (ResourceAccessException ex) {
            log.warn("Slack webhook unreachable", ex);
            return SendResult.failure("Slack webhook unreachable: " + ex.getMessage());
        } catch (RestClientException ex) {
            log.warn("Slack delivery failed", ex);
            return SendResult.failure("Slack delivery failed: " + ex.getMessage());
        }
    }

    private String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "<empty body>";
        }
        return body.length() <= MAX_BODY_IN_ERROR ? body : body.substring(0, MAX_BODY_IN_ERROR) + "...";
    }
}
