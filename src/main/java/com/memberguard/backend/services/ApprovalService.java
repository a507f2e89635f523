package com.memberguard.backend.services;

import com.memberguard.backend.config.LifecycleProperties;
import com.memberguard.backend.exceptions.RequestAlreadyProcessedException;
import com.memberguard.backend.exceptions.ResourceNotFoundException;
import com.memberguard.backend.integrations.GroupMembershipException;
import com.memberguard.backend.integrations.GroupMembershipProvider;
import com.memberguard.backend.integrations.OutboundMessage;
import com.memberguard.backend.models.AccessRequest;
import com.memberguard.backend.models.AuditLog;
import com.memberguard.backend.models.Plan;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.AccessRequestRepository;
import com.memberguard.backend.repositories.PlanRepository;
import com.memberguard.backend.repositories.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admin decisions on pending access requests
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalService {

    private final AccessRequestRepository accessRequestRepository;
    private final PlanRepository planRepository;
    private final UserRepository userRepository;
    private final SubscriptionService subscriptionService;
    private final ReferralService referralService;
    private final GroupMembershipProvider groupMembershipProvider;
    private final UserMessenger userMessenger;
    private final AuditService auditService;
    private final LifecycleProperties lifecycleProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public record ApprovalResult(AccessRequest request,
                                 Subscription subscription,
                                 boolean renewal,
                                 String inviteLink,
                                 ReferralService.BonusOutcome referralOutcome) {
    }

    private record Granted(AccessRequest request, User user, Plan plan, SubscriptionService.SubscriptionGrant grant) {
    }

    /**
     * Grants or extends access with the chosen plan. A renewing member who is still in the
     * group only gets a confirmation; everyone else gets a fresh single-use invite.
     *
     * The grant commits first. Nothing is sent and no referral bonus is paid until it has,
     * and the bonus runs in a transaction of its own.
     */
    public ApprovalResult approve(Long requestId, long adminId, Long planId) {
        Granted granted = transactionTemplate.execute(status -> grant(requestId, adminId, planId));

        User user = granted.user();
        Subscription subscription = granted.grant().subscription();
        boolean renewal = granted.grant().renewal();

        String inviteLink = null;
        if (renewal && isMemberOrAssume(user)) {
            userMessenger.send(user, OutboundMessage.plain(NotificationMessages.renewed(subscription, clock.getZone())));
        } else {
            inviteLink = groupMembershipProvider.createSingleUseInvite(user.getTelegramId(), lifecycleProperties.getInviteTtlSeconds());
            if (inviteLink == null) {
                log.warn("Approved request {} but no invite link could be created for user {}", requestId, user.getTelegramId());
            }
            userMessenger.send(user, OutboundMessage.plain(NotificationMessages.approved(subscription, inviteLink, clock.getZone())));
        }

        ReferralService.BonusOutcome referralOutcome = settleReferral(user);

        userMessenger.alertOperators(NotificationMessages.approvedAlert(user, subscription, adminId, renewal));

        log.info("Request {} approved by {}: user {} on {} until {}",
                requestId, adminId, user.getTelegramId(), granted.plan().getName(), subscription.getExpiryDate());
        return new ApprovalResult(granted.request(), subscription, renewal, inviteLink, referralOutcome);
    }

    private Granted grant(Long requestId, long adminId, Long planId) {
        AccessRequest request = loadPending(requestId);
        Plan plan = planRepository.findById(planId)
                .orElseThrow(() -> new ResourceNotFoundException("Plan", planId));
        if (!plan.isActive()) {
            throw new IllegalArgumentException("Plan " + plan.getName() + " is no longer offered");
        }

        User user = request.getUser();
        SubscriptionService.SubscriptionGrant grant = subscriptionService.createOrRenew(user, plan, adminId);

        request.approve(adminId, planId, grant.renewal(), OffsetDateTime.now(clock));
        accessRequestRepository.save(request);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requestId", requestId);
        details.put("planId", planId);
        details.put("planName", plan.getName());
        details.put("renewal", grant.renewal());
        details.put("expiryDate", grant.subscription().getExpiryDate().toString());
        auditService.record(adminId, AuditLog.ActionType.APPROVE_REQUEST, user.getTelegramId(), details);

        return new Granted(request, user, plan, grant);
    }

    public AccessRequest reject(Long requestId, long adminId) {
        AccessRequest request = transactionTemplate.execute(status -> {
            AccessRequest pending = loadPending(requestId);
            pending.reject(adminId, OffsetDateTime.now(clock));
            accessRequestRepository.save(pending);

            User user = pending.getUser();
            if (subscriptionService.findLive(user).isEmpty()) {
                user.setStatus(User.UserStatus.INACTIVE);
                userRepository.save(user);
            }

            auditService.record(adminId, AuditLog.ActionType.REJECT_REQUEST, user.getTelegramId(),
                    Map.of("requestId", requestId));
            return pending;
        });

        User user = request.getUser();
        userMessenger.send(user, OutboundMessage.plain(NotificationMessages.rejected()));
        userMessenger.alertOperators(NotificationMessages.rejectedAlert(user, adminId));

        log.info("Request {} rejected by {}", requestId, adminId);
        return request;
    }

    private AccessRequest loadPending(Long requestId) {
        AccessRequest request = accessRequestRepository.findById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Access request", requestId));
        if (!request.isPending()) {
            throw new RequestAlreadyProcessedException(requestId, request.getStatus().name());
        }
        return request;
    }

    /**
     * An unanswerable membership check counts as "not a member" so the user still gets an invite
     */
    private boolean isMemberOrAssume(User user) {
        try {
            return groupMembershipProvider.isMember(user.getTelegramId());
        } catch (GroupMembershipException e) {
            log.warn("Membership check for {} failed, sending an invite instead: {}", user.getTelegramId(), e.getMessage());
            return false;
        }
    }

    /**
     * The approval is already committed here, so a failed bonus only loses the bonus
     */
    private ReferralService.BonusOutcome settleReferral(User user) {
        try {
            return referralService.awardReferralBonus(user);
        } catch (RuntimeException e) {
            log.error("Referral bonus for user {} could not be settled: {}", user.getTelegramId(), e.getMessage(), e);
            return ReferralService.BonusOutcome.NOT_ELIGIBLE;
        }
    }
}
