package com.memberguard.backend.models;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Latches for the in-grace messages: day1 is the early reminder, day2 the final warning.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GraceNotifications {

    @Column(name = "grace_notified_day1", nullable = false)
    private boolean day1;

    @Column(name = "grace_notified_day2", nullable = false)
    private boolean day2;

    public static GraceNotifications cleared() {
        return new GraceNotifications();
    }
}
