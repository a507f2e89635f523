package com.memberguard.backend.lifecycle;

/**
 * What the grace job does with one GRACE subscription today.
 */
public record GraceAction(Kind kind, long daysSinceExpiry, int graceDaysUsed) {

    public enum Kind {
        /** Grace exhausted: remove from the group and expire */
        REMOVE,
        /** Last day before removal */
        FINAL_WARNING,
        /** First full day after expiry */
        EARLY_REMINDER,
        NONE
    }

    public boolean requiresMessage() {
        return kind == Kind.FINAL_WARNING || kind == Kind.EARLY_REMINDER;
    }
}
