package com.memberguard.backend.models;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * A user's request for premium access, decided by an admin.
 */
@Entity
@Table(name = "access_requests", indexes = {
        @Index(name = "idx_access_requests_status", columnList = "status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"user"})
public class AccessRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private RequestStatus status = RequestStatus.PENDING;

    @Column(name = "request_date", nullable = false)
    private OffsetDateTime requestDate;

    @Column(name = "action_date")
    private OffsetDateTime actionDate;

    @Column(name = "action_by")
    private Long actionBy;

    @Column(name = "selected_plan_id")
    private Long selectedPlanId;

    /**
     * Whether the approval extended a live subscription
     */
    @Column(name = "renewal", nullable = false)
    @Builder.Default
    private boolean renewal = false;

    public enum RequestStatus {
        PENDING,
        APPROVED,
        REJECTED
    }

    public boolean isPending() {
        return status == RequestStatus.PENDING;
    }

    public void approve(Long adminId, Long planId, boolean renewal, OffsetDateTime when) {
        this.status = RequestStatus.APPROVED;
        this.actionBy = adminId;
        this.selectedPlanId = planId;
        this.renewal = renewal;
        this.actionDate = when;
    }

    public void reject(Long adminId, OffsetDateTime when) {
        this.status = RequestStatus.REJECTED;
        this.actionBy = adminId;
        this.actionDate = when;
    }
}
