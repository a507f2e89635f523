package com.memberguard.backend.models;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * A chat user known to the bot. Created on first contact, never deleted.
 */
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(columnNames = "telegram_id"),
        @UniqueConstraint(columnNames = "referral_code")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"referredBy"})
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "telegram_id", nullable = false)
    private Long telegramId;

    @NotBlank(message = "Name is required")
    private String name;

    private String username;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private UserRole role = UserRole.USER;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private UserStatus status = UserStatus.INACTIVE;

    @Column(name = "is_blocked", nullable = false)
    @Builder.Default
    private boolean blocked = false;

    // ===== Referral program =====
    @Column(name = "referral_code", length = 8)
    @Builder.Default
    private String referralCode = newReferralCode();

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "referred_by")
    private User referredBy;

    @Column(name = "referral_bonus_applied", nullable = false)
    @Builder.Default
    private boolean referralBonusApplied = false;

    // ===== Activity & grace mirror =====
    @Column(name = "last_interaction")
    private OffsetDateTime lastInteraction;

    @Column(name = "grace_days_remaining")
    private Integer graceDaysRemaining;

    @Column(name = "awaiting_support_input", nullable = false)
    @Builder.Default
    private boolean awaitingSupportInput = false;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public enum UserRole {
        USER,
        ADMIN,
        SUPERADMIN
    }

    public enum UserStatus {
        ACTIVE,
        EXPIRED,
        PENDING,
        INACTIVE,
        BLOCKED
    }

    public static String newReferralCode() {
        return UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
    }

    public boolean isStaff() {
        return role == UserRole.ADMIN || role == UserRole.SUPERADMIN;
    }

    public boolean hasReferrer() {
        return referredBy != null;
    }
}
