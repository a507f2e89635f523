package com.memberguard.backend.lifecycle;

import com.memberguard.backend.models.Subscription;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides which subscriptions are owed a reminder at a checkpoint. No I/O.
 */
public final class ReminderPlanner {

    private ReminderPlanner() {
    }

    public record ReminderAction(Subscription subscription, ReminderCheckpoint checkpoint) {
    }

    /**
     * A subscription qualifies when it is ACTIVE, expires within the calendar day
     * {@code checkpoint} days after today, and the checkpoint's latch is still unset.
     */
    public static List<ReminderAction> plan(LocalDate today,
                                            ZoneId zone,
                                            ReminderCheckpoint checkpoint,
                                            Collection<Subscription> candidates) {
        LocalDate targetDay = today.plusDays(checkpoint.getDaysBeforeExpiry());

        return candidates.stream()
                .filter(sub -> sub.getStatus() == Subscription.SubscriptionStatus.ACTIVE)
                .filter(sub -> sub.getExpiryDate() != null
                        && LifecycleDates.isWithinDay(sub.getExpiryDate(), targetDay, zone))
                .filter(sub -> !checkpoint.isSent(sub.getReminderFlags()))
                .map(sub -> new ReminderAction(sub, checkpoint))
                .collect(Collectors.toList());
    }
}
