package com.memberguard.backend.integrations;

/**
 * Outcome of a single delivery attempt. There is no retry behind any of these.
 */
public enum DeliveryResult {
    DELIVERED,
    /** The recipient blocked the bot; further attempts will fail the same way */
    UNREACHABLE,
    TRANSIENT_ERROR;

    public boolean isDelivered() {
        return this == DELIVERED;
    }
}
