package com.memberguard.backend.integrations;

/**
 * Delivers messages to users and alerts to the operators' log channel.
 */
public interface NotificationGateway {

    /**
     * Single attempt, no internal retry.
     */
    DeliveryResult deliver(long chatId, OutboundMessage message);

    /**
     * Best effort post to the log channel. Never throws.
     */
    void alertOperators(String text);
}
