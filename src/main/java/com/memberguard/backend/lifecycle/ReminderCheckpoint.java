package com.memberguard.backend.lifecycle;

import com.memberguard.backend.models.ReminderFlags;

/**
 * Day offsets before expiry at which a reminder is due exactly once.
 */
public enum ReminderCheckpoint {
    DAY_7(7, "7 days"),
    DAY_3(3, "3 days"),
    DAY_1(1, "1 day"),
    DAY_0(0, "today");

    private final int daysBeforeExpiry;
    private final String label;

    ReminderCheckpoint(int daysBeforeExpiry, String label) {
        this.daysBeforeExpiry = daysBeforeExpiry;
        this.label = label;
    }

    public int getDaysBeforeExpiry() {
        return daysBeforeExpiry;
    }

    public String getLabel() {
        return label;
    }

    public boolean isSent(ReminderFlags flags) {
        return switch (this) {
            case DAY_7 -> flags.isDay7();
            case DAY_3 -> flags.isDay3();
            case DAY_1 -> flags.isDay1();
            case DAY_0 -> flags.isDay0();
        };
    }

    /**
     * Sets the latch. Never clears it.
     */
    public void markSent(ReminderFlags flags) {
        switch (this) {
            case DAY_7 -> flags.setDay7(true);
            case DAY_3 -> flags.setDay3(true);
            case DAY_1 -> flags.setDay1(true);
            case DAY_0 -> flags.setDay0(true);
        }
    }
}
