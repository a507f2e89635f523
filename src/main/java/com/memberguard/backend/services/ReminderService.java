package com.memberguard.backend.services;

import com.memberguard.backend.integrations.DeliveryResult;
import com.memberguard.backend.integrations.OutboundMessage;
import com.memberguard.backend.lifecycle.JobReport;
import com.memberguard.backend.lifecycle.LifecycleDates;
import com.memberguard.backend.lifecycle.LifecycleJob;
import com.memberguard.backend.lifecycle.ReminderCheckpoint;
import com.memberguard.backend.lifecycle.ReminderPlanner;
import com.memberguard.backend.lifecycle.ReminderPlanner.ReminderAction;
import com.memberguard.backend.models.Plan;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.repositories.PlanRepository;
import com.memberguard.backend.repositories.SubscriptionRepository;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily expiry reminders at 7, 3, 1 and 0 days before expiry, each sent at most once per
 * subscription period. A checkpoint missed because of a delivery failure is not retried later.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReminderService {

    private final SubscriptionRepository subscriptionRepository;
    private final PlanRepository planRepository;
    private final UserMessenger userMessenger;
    private final LifecycleMetrics lifecycleMetrics;
    private final Clock clock;

    public JobReport runReminders() {
        Timer.Sample sample = lifecycleMetrics.start();

        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);

        List<Subscription> candidates = subscriptionRepository.findByStatusAndExpiryDateBetween(
                Subscription.SubscriptionStatus.ACTIVE,
                LifecycleDates.startOfDay(today, zone),
                LifecycleDates.endOfDay(today.plusDays(ReminderCheckpoint.DAY_7.getDaysBeforeExpiry()), zone));

        List<ReminderAction> actions = new ArrayList<>();
        for (ReminderCheckpoint checkpoint : ReminderCheckpoint.values()) {
            actions.addAll(ReminderPlanner.plan(today, zone, checkpoint, candidates));
        }

        if (actions.isEmpty()) {
            log.debug("No reminders due on {}", today);
            JobReport report = JobReport.empty(LifecycleJob.REMINDERS);
            lifecycleMetrics.record(sample, report);
            return report;
        }

        List<Plan> renewalOptions = planRepository.findByActiveTrueOrderByDurationDaysAsc();
        int sent = 0;
        int skipped = 0;
        int failed = 0;

        for (ReminderAction action : actions) {
            try {
                if (sendReminder(action, renewalOptions, zone)) {
                    sent++;
                } else {
                    skipped++;
                }
            } catch (Exception e) {
                failed++;
                log.error("Failed to process {} reminder for subscription {}: {}",
                        action.checkpoint(), action.subscription().getId(), e.getMessage(), e);
            }
        }

        JobReport report = new JobReport(LifecycleJob.REMINDERS, actions.size(), sent, skipped, failed);
        log.info("Reminder run for {} finished: {} due, {} sent, {} skipped, {} failed",
                today, actions.size(), sent, skipped, failed);
        lifecycleMetrics.record(sample, report);
        return report;
    }

    /**
     * @return true when the reminder was delivered and its latch persisted
     */
    private boolean sendReminder(ReminderAction action, List<Plan> renewalOptions, ZoneId zone) {
        Subscription subscription = action.subscription();
        ReminderCheckpoint checkpoint = action.checkpoint();

        OutboundMessage message = OutboundMessage.withRenewalOptions(
                NotificationMessages.reminder(subscription, checkpoint, zone), renewalOptions);

        DeliveryResult result = userMessenger.send(subscription.getUser(), message);
        if (!result.isDelivered()) {
            log.info("{} reminder for subscription {} not delivered ({}), latch left unset",
                    checkpoint, subscription.getId(), result);
            return false;
        }

        checkpoint.markSent(subscription.getReminderFlags());
        subscriptionRepository.save(subscription);
        log.debug("{} reminder sent for subscription {}", checkpoint, subscription.getId());
        return true;
    }
}
