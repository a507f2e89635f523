package com.memberguard.backend.models;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Append-only audit trail. actorId 0 marks a system action.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_logs_action_time", columnList = "action_type, timestamp"),
        @Index(name = "idx_audit_logs_target", columnList = "target_user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    public static final long SYSTEM_ACTOR = 0L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "actor_id", nullable = false)
    private Long actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, length = 40)
    private ActionType actionType;

    @Column(name = "target_user_id")
    private Long targetUserId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> details;

    @Column(nullable = false)
    private OffsetDateTime timestamp;

    public enum ActionType {
        APPROVE_REQUEST,
        REJECT_REQUEST,
        BROADCAST,
        BAN_USER,
        USER_BLOCKED,
        MANUAL_EXPIRE,
        REFERRAL_BONUS
    }
}
