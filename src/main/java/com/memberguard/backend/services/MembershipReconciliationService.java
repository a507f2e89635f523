package com.memberguard.backend.services;

import com.memberguard.backend.config.LifecycleProperties;
import com.memberguard.backend.integrations.GroupMembershipException;
import com.memberguard.backend.integrations.GroupMembershipProvider;
import com.memberguard.backend.integrations.OutboundMessage;
import com.memberguard.backend.lifecycle.JobReport;
import com.memberguard.backend.lifecycle.LifecycleJob;
import com.memberguard.backend.models.AuditLog;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.SubscriptionRepository;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Repairs drift between subscription records and actual group membership.
 *
 * Under-provisioned: an ACTIVE, unexpired subscriber outside the group gets a fresh single-use invite.
 * Over-provisioned: a user whose subscriptions are all EXPIRED or CANCELLED but who is still
 * in the group is removed. Users holding an ACTIVE or GRACE subscription are never removed here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipReconciliationService {

    static final String REMOVAL_REASON = "removed by reconciler";

    private final SubscriptionRepository subscriptionRepository;
    private final GroupMembershipProvider groupMembershipProvider;
    private final UserMessenger userMessenger;
    private final AuditService auditService;
    private final LifecycleMetrics lifecycleMetrics;
    private final LifecycleProperties lifecycleProperties;
    private final Clock clock;

    private enum Outcome { REPAIRED, IN_SYNC, SKIPPED }

    public JobReport runReconciliation() {
        Timer.Sample sample = lifecycleMetrics.start();
        OffsetDateTime now = OffsetDateTime.now(clock);

        int candidates = 0;
        int repaired = 0;
        int skipped = 0;
        int failed = 0;

        // Pass 1: paying users missing from the group
        for (Subscription subscription : subscriptionRepository.findByStatusAndExpiryDateAfter(
                Subscription.SubscriptionStatus.ACTIVE, now)) {
            candidates++;
            try {
                Outcome outcome = ensureMember(subscription.getUser());
                if (outcome == Outcome.REPAIRED) {
                    repaired++;
                } else if (outcome == Outcome.SKIPPED) {
                    skipped++;
                }
            } catch (Exception e) {
                failed++;
                log.error("Failed to reconcile active subscription {}: {}", subscription.getId(), e.getMessage(), e);
            }
        }

        // Pass 2: lapsed users still in the group, one check per user
        Set<Long> checkedUsers = new HashSet<>();
        for (Subscription subscription : subscriptionRepository.findByStatusIn(Subscription.TERMINAL_STATUSES)) {
            User user = subscription.getUser();
            if (!checkedUsers.add(user.getTelegramId())) {
                continue;
            }
            candidates++;
            try {
                if (subscriptionRepository.existsByUserAndStatusIn(user, Subscription.LIVE_STATUSES)) {
                    continue;
                }
                Outcome outcome = ensureRemoved(user);
                if (outcome == Outcome.REPAIRED) {
                    repaired++;
                } else if (outcome == Outcome.SKIPPED) {
                    skipped++;
                }
            } catch (Exception e) {
                failed++;
                log.error("Failed to reconcile lapsed user {}: {}", user.getTelegramId(), e.getMessage(), e);
            }
        }

        JobReport report = new JobReport(LifecycleJob.MEMBERSHIP_RECONCILIATION, candidates, repaired, skipped, failed);
        log.info("Reconciliation finished: {} checked, {} repaired, {} skipped, {} failed",
                candidates, repaired, skipped, failed);
        lifecycleMetrics.record(sample, report);
        return report;
    }

    private Outcome ensureMember(User user) {
        long telegramId = user.getTelegramId();
        try {
            if (groupMembershipProvider.isMember(telegramId)) {
                return Outcome.IN_SYNC;
            }
        } catch (GroupMembershipException e) {
            log.warn("Membership check for {} failed, skipping: {}", telegramId, e.getMessage());
            return Outcome.SKIPPED;
        }

        int ttlSeconds = lifecycleProperties.getInviteTtlSeconds();
        String inviteLink = groupMembershipProvider.createSingleUseInvite(telegramId, ttlSeconds);
        if (inviteLink == null) {
            log.warn("No invite link could be created for {}, skipping", telegramId);
            return Outcome.SKIPPED;
        }

        userMessenger.send(user, OutboundMessage.plain(NotificationMessages.rejoinInvite(inviteLink, ttlSeconds)));
        log.info("Sent rejoin invite to active subscriber {}", telegramId);
        return Outcome.REPAIRED;
    }

    private Outcome ensureRemoved(User user) {
        long telegramId = user.getTelegramId();
        try {
            if (!groupMembershipProvider.isMember(telegramId)) {
                return Outcome.IN_SYNC;
            }
        } catch (GroupMembershipException e) {
            log.warn("Membership check for {} failed, skipping: {}", telegramId, e.getMessage());
            return Outcome.SKIPPED;
        }

        if (!groupMembershipProvider.removeMember(telegramId)) {
            log.warn("Could not remove lapsed user {}, will retry on the next run", telegramId);
            return Outcome.SKIPPED;
        }

        auditService.recordSystem(AuditLog.ActionType.BAN_USER, telegramId, Map.of("reason", REMOVAL_REASON));
        userMessenger.alertOperators(NotificationMessages.removedAlert(user, REMOVAL_REASON));
        log.info("Removed lapsed user {} from group", telegramId);
        return Outcome.REPAIRED;
    }
}
