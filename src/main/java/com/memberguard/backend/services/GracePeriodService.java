package com.memberguard.backend.services;

import com.memberguard.backend.config.LifecycleProperties;
import com.memberguard.backend.integrations.DeliveryResult;
import com.memberguard.backend.integrations.GroupMembershipProvider;
import com.memberguard.backend.integrations.OutboundMessage;
import com.memberguard.backend.lifecycle.GraceAction;
import com.memberguard.backend.lifecycle.GracePlanner;
import com.memberguard.backend.lifecycle.JobReport;
import com.memberguard.backend.lifecycle.LifecycleDates;
import com.memberguard.backend.lifecycle.LifecycleJob;
import com.memberguard.backend.models.AuditLog;
import com.memberguard.backend.models.Plan;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.PlanRepository;
import com.memberguard.backend.repositories.SubscriptionRepository;
import com.memberguard.backend.repositories.UserRepository;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily grace sweep. First moves lapsed ACTIVE subscriptions into GRACE, then walks every
 * GRACE subscription: escalating warnings, and removal from the group once grace is used up.
 * A subscription that entered grace in this run is evaluated again by the second pass, so one
 * that lapsed long ago still passes through GRACE before it is removed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GracePeriodService {

    static final String REMOVAL_REASON = "grace period expired";

    private final SubscriptionRepository subscriptionRepository;
    private final UserRepository userRepository;
    private final PlanRepository planRepository;
    private final UserMessenger userMessenger;
    private final GroupMembershipProvider groupMembershipProvider;
    private final AuditService auditService;
    private final LifecycleMetrics lifecycleMetrics;
    private final LifecycleProperties lifecycleProperties;
    private final Clock clock;

    public JobReport runGracePeriod() {
        Timer.Sample sample = lifecycleMetrics.start();

        ZoneId zone = clock.getZone();
        OffsetDateTime startOfToday = LifecycleDates.startOfDay(LocalDate.now(clock), zone);
        int gracePeriodDays = lifecycleProperties.getGracePeriodDays();
        List<Plan> renewalOptions = planRepository.findByActiveTrueOrderByDurationDaysAsc();

        int candidates = 0;
        int succeeded = 0;
        int skipped = 0;
        int failed = 0;

        // Pass 1: grace entry
        List<Subscription> lapsed = GracePlanner.dueForGraceEntry(startOfToday,
                subscriptionRepository.findByStatusAndExpiryDateBefore(Subscription.SubscriptionStatus.ACTIVE, startOfToday));

        for (Subscription subscription : lapsed) {
            candidates++;
            try {
                enterGrace(subscription, gracePeriodDays, renewalOptions, zone);
                succeeded++;
            } catch (Exception e) {
                failed++;
                log.error("Failed to start grace period for subscription {}: {}", subscription.getId(), e.getMessage(), e);
            }
        }

        // Pass 2: subscriptions already in grace
        for (Subscription subscription : subscriptionRepository.findByStatus(Subscription.SubscriptionStatus.GRACE)) {
            candidates++;
            try {
                GraceAction action = GracePlanner.decide(subscription, startOfToday, gracePeriodDays);
                if (apply(subscription, action, gracePeriodDays, renewalOptions)) {
                    succeeded++;
                } else {
                    skipped++;
                }
            } catch (Exception e) {
                failed++;
                log.error("Failed to process grace subscription {}: {}", subscription.getId(), e.getMessage(), e);
            }
        }

        JobReport report = new JobReport(LifecycleJob.GRACE_PERIOD, candidates, succeeded, skipped, failed);
        log.info("Grace run finished: {} entered grace, {} candidates, {} processed, {} skipped, {} failed",
                lapsed.size(), candidates, succeeded, skipped, failed);
        lifecycleMetrics.record(sample, report);
        return report;
    }

    private void enterGrace(Subscription subscription, int gracePeriodDays, List<Plan> renewalOptions, ZoneId zone) {
        subscription.enterGrace();
        subscriptionRepository.save(subscription);

        User user = subscription.getUser();
        user.setStatus(User.UserStatus.EXPIRED);
        user.setGraceDaysRemaining(gracePeriodDays);
        userRepository.save(user);

        userMessenger.send(user, OutboundMessage.withRenewalOptions(
                NotificationMessages.graceStarted(subscription, gracePeriodDays, zone), renewalOptions));
        userMessenger.alertOperators(NotificationMessages.graceStartedAlert(user, gracePeriodDays));

        log.info("Subscription {} of user {} entered grace ({} days)",
                subscription.getId(), user.getTelegramId(), gracePeriodDays);
    }

    /**
     * @return false when nothing was due or the removal has to wait for the next run
     */
    private boolean apply(Subscription subscription, GraceAction action, int gracePeriodDays, List<Plan> renewalOptions) {
        User user = subscription.getUser();

        switch (action.kind()) {
            case REMOVE -> {
                return removeAfterGrace(subscription, action, gracePeriodDays);
            }
            case FINAL_WARNING -> {
                subscription.getGraceNotifications().setDay2(true);
                recordProgress(subscription, user, action, gracePeriodDays);
                DeliveryResult result = userMessenger.send(user, OutboundMessage.withRenewalOptions(
                        NotificationMessages.finalGraceWarning(), renewalOptions));
                log.info("Final grace warning for subscription {}: {}", subscription.getId(), result);
                return true;
            }
            case EARLY_REMINDER -> {
                int daysLeft = gracePeriodDays - action.graceDaysUsed();
                subscription.getGraceNotifications().setDay1(true);
                recordProgress(subscription, user, action, gracePeriodDays);
                DeliveryResult result = userMessenger.send(user, OutboundMessage.withRenewalOptions(
                        NotificationMessages.earlyGraceReminder(daysLeft), renewalOptions));
                log.info("Early grace reminder for subscription {}: {}", subscription.getId(), result);
                return true;
            }
            default -> {
                if (subscription.getGraceDaysUsed() != action.graceDaysUsed()) {
                    recordProgress(subscription, user, action, gracePeriodDays);
                }
                return false;
            }
        }
    }

    private boolean removeAfterGrace(Subscription subscription, GraceAction action, int gracePeriodDays) {
        User user = subscription.getUser();

        if (!groupMembershipProvider.removeMember(user.getTelegramId())) {
            log.warn("Removal of user {} failed, subscription {} stays in grace until the next run",
                    user.getTelegramId(), subscription.getId());
            userMessenger.alertOperators(NotificationMessages.removalFailedAlert(user));
            return false;
        }

        subscription.expireAfterGrace(gracePeriodDays);
        subscriptionRepository.save(subscription);

        user.setStatus(User.UserStatus.EXPIRED);
        user.setGraceDaysRemaining(0);
        userRepository.save(user);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", REMOVAL_REASON);
        details.put("daysOverdue", action.daysSinceExpiry());
        details.put("subscriptionId", subscription.getId());
        auditService.recordSystem(AuditLog.ActionType.BAN_USER, user.getTelegramId(), details);

        userMessenger.send(user, OutboundMessage.plain(NotificationMessages.removedAfterGrace()));
        userMessenger.alertOperators(NotificationMessages.removedAlert(user, REMOVAL_REASON));

        log.info("User {} removed after grace, subscription {} expired ({} days overdue)",
                user.getTelegramId(), subscription.getId(), action.daysSinceExpiry());
        return true;
    }

    /**
     * Must run before any send: a send that finds the recipient unreachable persists the
     * blocked user, and a later save of this copy would undo it.
     */
    private void recordProgress(Subscription subscription, User user, GraceAction action, int gracePeriodDays) {
        subscription.setGraceDaysUsed(action.graceDaysUsed());
        subscriptionRepository.save(subscription);

        user.setGraceDaysRemaining(gracePeriodDays - action.graceDaysUsed());
        userRepository.save(user);
    }
}
