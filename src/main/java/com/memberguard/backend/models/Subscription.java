package com.memberguard.backend.models;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle entity: ACTIVE -> GRACE -> EXPIRED, or CANCELLED by an admin.
 * At most one ACTIVE/GRACE row exists per user; renewals mutate that row.
 * Terminal rows are kept for reporting.
 */
@Entity
@Table(name = "subscriptions", indexes = {
        @Index(name = "idx_subscriptions_status_expiry", columnList = "status, expiry_date"),
        @Index(name = "idx_subscriptions_user", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"user"})
public class Subscription {

    public static final Set<SubscriptionStatus> LIVE_STATUSES =
            EnumSet.of(SubscriptionStatus.ACTIVE, SubscriptionStatus.GRACE);

    public static final Set<SubscriptionStatus> TERMINAL_STATUSES =
            EnumSet.of(SubscriptionStatus.EXPIRED, SubscriptionStatus.CANCELLED);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    // Plan snapshot taken at issuance
    @Column(name = "plan_id")
    private Long planId;

    @Column(name = "plan_name", nullable = false)
    private String planName;

    @Column(name = "duration_days", nullable = false)
    private int durationDays;

    @Column(name = "start_date", nullable = false)
    private OffsetDateTime startDate;

    @Column(name = "expiry_date", nullable = false)
    private OffsetDateTime expiryDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SubscriptionStatus status = SubscriptionStatus.ACTIVE;

    @Embedded
    @Builder.Default
    private ReminderFlags reminderFlags = ReminderFlags.cleared();

    @Column(name = "grace_days_used", nullable = false)
    @Builder.Default
    private int graceDaysUsed = 0;

    @Embedded
    @Builder.Default
    private GraceNotifications graceNotifications = GraceNotifications.cleared();

    @Column(name = "is_renewal", nullable = false)
    @Builder.Default
    private boolean renewal = false;

    /**
     * Telegram id of the approving admin
     */
    @Column(name = "approved_by")
    private Long approvedBy;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public enum SubscriptionStatus {
        ACTIVE,
        GRACE,
        EXPIRED,
        CANCELLED
    }

    public boolean isLive() {
        return LIVE_STATUSES.contains(status);
    }

    public boolean isTerminal() {
        return TERMINAL_STATUSES.contains(status);
    }

    public Long getTelegramId() {
        return user != null ? user.getTelegramId() : null;
    }

    /**
     * Extends this live subscription with the given plan. Time left is never lost:
     * the new period starts at the later of the current expiry and now. All latches reset.
     */
    public void renewWith(Plan plan, OffsetDateTime now, Long adminId) {
        if (!isLive()) {
            throw new IllegalStateException("Only an active or grace subscription can be renewed, was " + status);
        }
        OffsetDateTime base = expiryDate != null && expiryDate.isAfter(now) ? expiryDate : now;
        this.expiryDate = base.plusDays(plan.getDurationDays());
        this.planId = plan.getId();
        this.planName = plan.getName();
        this.durationDays = plan.getDurationDays();
        this.status = SubscriptionStatus.ACTIVE;
        this.approvedBy = adminId;
        this.renewal = true;
        this.graceDaysUsed = 0;
        this.reminderFlags = ReminderFlags.cleared();
        this.graceNotifications = GraceNotifications.cleared();
    }

    public void enterGrace() {
        this.status = SubscriptionStatus.GRACE;
        this.graceDaysUsed = 0;
        this.graceNotifications = GraceNotifications.cleared();
    }

    public void expireAfterGrace(int gracePeriodDays) {
        this.status = SubscriptionStatus.EXPIRED;
        this.graceDaysUsed = gracePeriodDays;
    }

    public void cancel() {
        this.status = SubscriptionStatus.CANCELLED;
    }

    public static Subscription issue(User user, Plan plan, OffsetDateTime now, Long adminId) {
        return Subscription.builder()
                .user(user)
                .planId(plan.getId())
                .planName(plan.getName())
                .durationDays(plan.getDurationDays())
                .startDate(now)
                .expiryDate(now.plusDays(plan.getDurationDays()))
                .status(SubscriptionStatus.ACTIVE)
                .approvedBy(adminId)
                .renewal(false)
                .build();
    }
}
