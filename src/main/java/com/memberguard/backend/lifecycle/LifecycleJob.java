package com.memberguard.backend.lifecycle;

public enum LifecycleJob {
    REMINDERS,
    GRACE_PERIOD,
    INACTIVE_USERS,
    MEMBERSHIP_RECONCILIATION,
    DAILY_SUMMARY,
    OFFER_EXPIRY
}
