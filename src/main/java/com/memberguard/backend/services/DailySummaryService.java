package com.memberguard.backend.services;

import com.memberguard.backend.lifecycle.JobReport;
import com.memberguard.backend.lifecycle.LifecycleDates;
import com.memberguard.backend.lifecycle.LifecycleJob;
import com.memberguard.backend.models.AccessRequest;
import com.memberguard.backend.models.AuditLog;
import com.memberguard.backend.models.DailySummary;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.repositories.AccessRequestRepository;
import com.memberguard.backend.repositories.AuditLogRepository;
import com.memberguard.backend.repositories.DailySummaryRepository;
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

/**
 * Nightly counters for the current day, upserted and posted to the operators
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DailySummaryService {

    private final UserRepository userRepository;
    private final AccessRequestRepository accessRequestRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final AuditLogRepository auditLogRepository;
    private final DailySummaryRepository dailySummaryRepository;
    private final UserMessenger userMessenger;
    private final LifecycleMetrics lifecycleMetrics;
    private final Clock clock;

    public DailySummary buildSummary(LocalDate day) {
        ZoneId zone = clock.getZone();
        OffsetDateTime start = LifecycleDates.startOfDay(day, zone);
        OffsetDateTime end = LifecycleDates.endOfDay(day, zone);

        DailySummary summary = dailySummaryRepository.findByDate(day)
                .orElseGet(() -> DailySummary.builder().date(day).build());

        summary.setNewUsers(userRepository.countByCreatedAtBetween(start, end));
        summary.setRequestsReceived(accessRequestRepository.countByRequestDateBetween(start, end));
        summary.setApprovals(accessRequestRepository.countByStatusAndActionDateBetween(
                AccessRequest.RequestStatus.APPROVED, start, end));
        summary.setRenewals(accessRequestRepository.countByStatusAndRenewalTrueAndActionDateBetween(
                AccessRequest.RequestStatus.APPROVED, start, end));
        summary.setExpiredToday(subscriptionRepository.countByStatusAndUpdatedAtBetween(
                Subscription.SubscriptionStatus.EXPIRED, start, end));
        summary.setRemovedFromGroup(auditLogRepository.countByActionTypeAndTimestampBetween(
                AuditLog.ActionType.BAN_USER, start, end));
        summary.setBroadcasts(auditLogRepository.countByActionTypeAndTimestampBetween(
                AuditLog.ActionType.BROADCAST, start, end));

        dailySummaryRepository.save(summary);
        return summary;
    }

    public JobReport runDailySummary() {
        Timer.Sample sample = lifecycleMetrics.start();
        LocalDate today = LocalDate.now(clock);

        DailySummary summary = buildSummary(today);
        userMessenger.alertOperators(NotificationMessages.dailySummary(summary));

        log.info("Daily summary for {}: {} new users, {} approvals, {} removed",
                today, summary.getNewUsers(), summary.getApprovals(), summary.getRemovedFromGroup());
        JobReport report = new JobReport(LifecycleJob.DAILY_SUMMARY, 1, 1, 0, 0);
        lifecycleMetrics.record(sample, report);
        return report;
    }
}
