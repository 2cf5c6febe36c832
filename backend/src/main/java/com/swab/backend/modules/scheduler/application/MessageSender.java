package com.swab.backend.modules.scheduler.application;

/**
 * Delivers a text payload to the fixed outbound channel.
 * Implementations report failures through {@link SendResult} and bound their own network calls with a timeout.
 */
public interface MessageSender {

    SendResult send(String text);
}
