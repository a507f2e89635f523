package com.memberguard.backend.models;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * One-way latches for the pre-expiry reminders. Cleared only by a renewal.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReminderFlags {

    @Column(name = "reminder_day7", nullable = false)
    private boolean day7;

    @Column(name = "reminder_day3", nullable = false)
    private boolean day3;

    @Column(name = "reminder_day1", nullable = false)
    private boolean day1;

    @Column(name = "reminder_day0", nullable = false)
    private boolean day0;

    public static ReminderFlags cleared() {
        return new ReminderFlags();
    }
}
