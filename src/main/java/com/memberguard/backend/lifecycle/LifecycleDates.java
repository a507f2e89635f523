package com.memberguard.backend.lifecycle;

import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * Calendar-day arithmetic shared by the lifecycle jobs. All days are evaluated in one zone.
 */
public final class LifecycleDates {

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private LifecycleDates() {
    }

    public static OffsetDateTime startOfDay(LocalDate day, ZoneId zone) {
        return day.atStartOfDay(zone).toOffsetDateTime();
    }

    /**
     * Last representable instant of the day, inclusive
     */
    public static OffsetDateTime endOfDay(LocalDate day, ZoneId zone) {
        return day.plusDays(1).atStartOfDay(zone).toOffsetDateTime().minusNanos(1);
    }

    public static boolean isWithinDay(OffsetDateTime instant, LocalDate day, ZoneId zone) {
        return !instant.isBefore(startOfDay(day, zone)) && !instant.isAfter(endOfDay(day, zone));
    }

    /**
     * Whole days elapsed from expiry to the start of today, rounded down.
     * Negative while the expiry is still after midnight today.
     */
    public static long daysSinceExpiry(OffsetDateTime expiryDate, OffsetDateTime startOfToday) {
        long millis = Duration.between(expiryDate, startOfToday).toMillis();
        return Math.floorDiv(millis, MILLIS_PER_DAY);
    }
}
