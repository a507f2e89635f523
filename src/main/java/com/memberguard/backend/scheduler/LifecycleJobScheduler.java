package com.memberguard.backend.scheduler;

import com.memberguard.backend.lifecycle.JobReport;
import com.memberguard.backend.lifecycle.LifecycleJob;
import com.memberguard.backend.services.DailySummaryService;
import com.memberguard.backend.services.GracePeriodService;
import com.memberguard.backend.services.InactiveUserService;
import com.memberguard.backend.services.MembershipReconciliationService;
import com.memberguard.backend.services.OfferService;
import com.memberguard.backend.services.ReminderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Daily lifecycle triggers. Orchestration only: each job owns its own error handling,
 * and a job never overlaps with another run of itself (scheduled or started by an admin).
 *
 * Times are cron expressions under {@code app.schedule.*}, evaluated in {@code app.lifecycle.zone}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LifecycleJobScheduler {

    private final ReminderService reminderService;
    private final GracePeriodService gracePeriodService;
    private final InactiveUserService inactiveUserService;
    private final MembershipReconciliationService membershipReconciliationService;
    private final DailySummaryService dailySummaryService;
    private final OfferService offerService;

    private final Set<LifecycleJob> running = ConcurrentHashMap.newKeySet();

    @Scheduled(cron = "${app.schedule.reminders:0 0 8 * * *}", zone = "${app.lifecycle.zone:UTC}")
    public void reminders() {
        run(LifecycleJob.REMINDERS);
    }

    @Scheduled(cron = "${app.schedule.grace-period:0 0 9 * * *}", zone = "${app.lifecycle.zone:UTC}")
    public void gracePeriod() {
        run(LifecycleJob.GRACE_PERIOD);
    }

    @Scheduled(cron = "${app.schedule.inactive-users:0 0 10 * * *}", zone = "${app.lifecycle.zone:UTC}")
    public void inactiveUsers() {
        run(LifecycleJob.INACTIVE_USERS);
    }

    @Scheduled(cron = "${app.schedule.reconciliation:0 0 11 * * *}", zone = "${app.lifecycle.zone:UTC}")
    public void membershipReconciliation() {
        run(LifecycleJob.MEMBERSHIP_RECONCILIATION);
    }

    @Scheduled(cron = "${app.schedule.daily-summary:0 59 23 * * *}", zone = "${app.lifecycle.zone:UTC}")
    public void dailySummary() {
        run(LifecycleJob.DAILY_SUMMARY);
    }

    @Scheduled(cron = "${app.schedule.offer-expiry:0 5 0 * * *}", zone = "${app.lifecycle.zone:UTC}")
    public void offerExpiry() {
        run(LifecycleJob.OFFER_EXPIRY);
    }

    /**
     * @return the run's report, or empty when the job was already running or failed outright
     */
    public Optional<JobReport> run(LifecycleJob job) {
        if (!running.add(job)) {
            log.warn("{} is already running, skipping this trigger", job);
            return Optional.empty();
        }

        log.info("Starting {} job", job);
        try {
            JobReport report = switch (job) {
                case REMINDERS -> reminderService.runReminders();
                case GRACE_PERIOD -> gracePeriodService.runGracePeriod();
                case INACTIVE_USERS -> inactiveUserService.runInactiveUsers();
                case MEMBERSHIP_RECONCILIATION -> membershipReconciliationService.runReconciliation();
                case DAILY_SUMMARY -> dailySummaryService.runDailySummary();
                case OFFER_EXPIRY -> offerService.deactivateExpired();
            };
            log.info("{} job completed: {}", job, report);
            return Optional.ofNullable(report);
        } catch (Exception e) {
            log.error("{} job failed: {}", job, e.getMessage(), e);
            return Optional.empty();
        } finally {
            running.remove(job);
        }
    }
}
