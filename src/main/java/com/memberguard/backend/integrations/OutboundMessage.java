package com.memberguard.backend.integrations;

import com.memberguard.backend.models.Plan;

import java.util.List;

/**
 * Markdown text plus the plans offered as one-tap renewal options (may be empty).
 */
public record OutboundMessage(String text, List<Plan> renewalOptions) {

    public OutboundMessage {
        renewalOptions = renewalOptions == null ? List.of() : List.copyOf(renewalOptions);
    }

    public static OutboundMessage plain(String text) {
        return new OutboundMessage(text, List.of());
    }

    public static OutboundMessage withRenewalOptions(String text, List<Plan> plans) {
        return new OutboundMessage(text, plans);
    }

    public boolean hasRenewalOptions() {
        return !renewalOptions.isEmpty();
    }
}
