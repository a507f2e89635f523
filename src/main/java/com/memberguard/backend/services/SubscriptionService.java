package com.memberguard.backend.services;

import com.memberguard.backend.dto.PlanPerformanceDto;
import com.memberguard.backend.dto.PlanSalesDto;
import com.memberguard.backend.dto.SalesReportDto;
import com.memberguard.backend.exceptions.ResourceNotFoundException;
import com.memberguard.backend.integrations.GroupMembershipProvider;
import com.memberguard.backend.integrations.OutboundMessage;
import com.memberguard.backend.lifecycle.LifecycleDates;
import com.memberguard.backend.models.AuditLog;
import com.memberguard.backend.models.Plan;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.SubscriptionRepository;
import com.memberguard.backend.repositories.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Issuing, renewing and cancelling subscriptions, plus the subscription reports
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final UserRepository userRepository;
    private final GroupMembershipProvider groupMembershipProvider;
    private final UserMessenger userMessenger;
    private final AuditService auditService;
    private final Clock clock;

    public record SubscriptionGrant(Subscription subscription, boolean renewal) {
    }

    public Optional<Subscription> findLive(User user) {
        return subscriptionRepository.findFirstByUserAndStatusIn(user, Subscription.LIVE_STATUSES);
    }

    /**
     * Renews the user's ACTIVE or GRACE subscription in place, or issues a new one when
     * there is none. Either way the user ends up ACTIVE with no grace countdown.
     */
    @Transactional
    public SubscriptionGrant createOrRenew(User user, Plan plan, Long adminId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<Subscription> live = findLive(user);

        Subscription subscription;
        boolean renewal;
        if (live.isPresent()) {
            subscription = live.get();
            OffsetDateTime previousExpiry = subscription.getExpiryDate();
            subscription.renewWith(plan, now, adminId);
            renewal = true;
            log.info("Renewed subscription {} of user {}: {} -> {}",
                    subscription.getId(), user.getTelegramId(), previousExpiry, subscription.getExpiryDate());
        } else {
            subscription = Subscription.issue(user, plan, now, adminId);
            renewal = false;
            log.info("Issued {} subscription to user {} until {}",
                    plan.getName(), user.getTelegramId(), subscription.getExpiryDate());
        }
        subscriptionRepository.save(subscription);

        user.setStatus(User.UserStatus.ACTIVE);
        user.setGraceDaysRemaining(null);
        userRepository.save(user);

        return new SubscriptionGrant(subscription, renewal);
    }

    /**
     * Admin cancellation. The member is removed from the group on a best-effort basis;
     * the reconciler retries a failed removal on its next run.
     */
    @Transactional
    public Subscription cancel(Long subscriptionId, long adminId) {
        Subscription subscription = subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new ResourceNotFoundException("Subscription", subscriptionId));

        if (!subscription.isLive()) {
            throw new IllegalStateException("Subscription " + subscriptionId + " is already " + subscription.getStatus());
        }

        subscription.cancel();
        subscriptionRepository.save(subscription);

        User user = subscription.getUser();
        user.setStatus(User.UserStatus.EXPIRED);
        user.setGraceDaysRemaining(null);
        userRepository.save(user);

        boolean removed = groupMembershipProvider.removeMember(user.getTelegramId());
        if (!removed) {
            log.warn("Cancelled subscription {} but could not remove user {} from group", subscriptionId, user.getTelegramId());
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("subscriptionId", subscriptionId);
        details.put("planName", subscription.getPlanName());
        details.put("removedFromGroup", removed);
        auditService.record(adminId, AuditLog.ActionType.MANUAL_EXPIRE, user.getTelegramId(), details);

        userMessenger.send(user, OutboundMessage.plain(NotificationMessages.cancelled()));
        userMessenger.alertOperators(NotificationMessages.cancelledAlert(user, adminId));
        return subscription;
    }

    // ========================================
    // Reports
    // ========================================

    /**
     * ACTIVE subscriptions expiring during today's calendar day
     */
    @Transactional(readOnly = true)
    public List<Subscription> todayExpiryList() {
        LocalDate today = LocalDate.now(clock);
        ZoneId zone = clock.getZone();
        return subscriptionRepository.findByStatusAndExpiryDateBetween(
                Subscription.SubscriptionStatus.ACTIVE,
                LifecycleDates.startOfDay(today, zone),
                LifecycleDates.endOfDay(today, zone));
    }

    /**
     * Subscriptions issued per plan between two days, both inclusive. Cancelled ones are not sales.
     */
    @Transactional(readOnly = true)
    public SalesReportDto salesReport(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Report range ends before it starts: " + from + " > " + to);
        }
        ZoneId zone = clock.getZone();

        List<PlanSalesDto> rows = subscriptionRepository.salesByPlan(
                        LifecycleDates.startOfDay(from, zone),
                        LifecycleDates.endOfDay(to, zone),
                        EnumSet.of(Subscription.SubscriptionStatus.ACTIVE,
                                Subscription.SubscriptionStatus.GRACE,
                                Subscription.SubscriptionStatus.EXPIRED))
                .stream()
                .map(row -> PlanSalesDto.builder()
                        .planName((String) row[0])
                        .subscriptions(((Number) row[1]).longValue())
                        .revenue(toBigDecimal(row[2]))
                        .build())
                .collect(Collectors.toList());

        return SalesReportDto.builder()
                .from(from)
                .to(to)
                .plans(rows)
                .build();
    }

    @Transactional(readOnly = true)
    public List<PlanPerformanceDto> planPerformance() {
        return subscriptionRepository.countLiveByPlan(Subscription.SubscriptionStatus.ACTIVE, OffsetDateTime.now(clock))
                .stream()
                .map(row -> PlanPerformanceDto.builder()
                        .planName((String) row[0])
                        .durationDays(((Number) row[1]).intValue())
                        .activeSubscriptions(((Number) row[2]).longValue())
                        .build())
                .collect(Collectors.toList());
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        return value == null ? BigDecimal.ZERO : new BigDecimal(value.toString());
    }
}
