package com.memberguard.backend.lifecycle;

import com.memberguard.backend.models.GraceNotifications;
import com.memberguard.backend.models.Subscription;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Grace-period state machine, evaluated against the start of today. No I/O.
 *
 * ACTIVE subscriptions whose expiry lies before today enter GRACE. A GRACE subscription is
 * removed once {@code daysSinceExpiry >= gracePeriodDays}. Before that it gets a final warning
 * when one day is left (latch day2) and an early reminder on the first full day after expiry
 * (latch day1). The early reminder only exists when it falls strictly before the final
 * warning, so short grace periods never send the two out of order.
 */
public final class GracePlanner {

    private GracePlanner() {
    }

    public static List<Subscription> dueForGraceEntry(OffsetDateTime startOfToday, Collection<Subscription> candidates) {
        return candidates.stream()
                .filter(sub -> sub.getStatus() == Subscription.SubscriptionStatus.ACTIVE)
                .filter(sub -> sub.getExpiryDate() != null && sub.getExpiryDate().isBefore(startOfToday))
                .collect(Collectors.toList());
    }

    public static GraceAction decide(Subscription subscription, OffsetDateTime startOfToday, int gracePeriodDays) {
        if (gracePeriodDays < 1) {
            throw new IllegalArgumentException("gracePeriodDays must be at least 1, was " + gracePeriodDays);
        }
        if (subscription.getStatus() != Subscription.SubscriptionStatus.GRACE) {
            return new GraceAction(GraceAction.Kind.NONE, 0, subscription.getGraceDaysUsed());
        }

        long daysSinceExpiry = LifecycleDates.daysSinceExpiry(subscription.getExpiryDate(), startOfToday);
        int graceDaysUsed = (int) Math.max(0, Math.min(daysSinceExpiry, gracePeriodDays));
        GraceNotifications sent = subscription.getGraceNotifications();

        if (daysSinceExpiry >= gracePeriodDays) {
            return new GraceAction(GraceAction.Kind.REMOVE, daysSinceExpiry, gracePeriodDays);
        }
        if (daysSinceExpiry == gracePeriodDays - 1 && !sent.isDay2()) {
            return new GraceAction(GraceAction.Kind.FINAL_WARNING, daysSinceExpiry, graceDaysUsed);
        }
        if (daysSinceExpiry == 1 && 1 < gracePeriodDays - 1 && !sent.isDay1()) {
            return new GraceAction(GraceAction.Kind.EARLY_REMINDER, daysSinceExpiry, graceDaysUsed);
        }
        return new GraceAction(GraceAction.Kind.NONE, daysSinceExpiry, graceDaysUsed);
    }
}
