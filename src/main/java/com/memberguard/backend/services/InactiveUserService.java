package com.memberguard.backend.services;

import com.memberguard.backend.config.LifecycleProperties;
import com.memberguard.backend.integrations.OutboundMessage;
import com.memberguard.backend.lifecycle.JobReport;
import com.memberguard.backend.lifecycle.LifecycleJob;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.UserRepository;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Re-engagement messages for users who went quiet or let their subscription lapse
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InactiveUserService {

    private final UserRepository userRepository;
    private final UserMessenger userMessenger;
    private final LifecycleMetrics lifecycleMetrics;
    private final LifecycleProperties lifecycleProperties;
    private final Clock clock;

    public JobReport runInactiveUsers() {
        Timer.Sample sample = lifecycleMetrics.start();
        OffsetDateTime now = OffsetDateTime.now(clock);

        List<User> candidates = userRepository.findReengagementCandidates(
                User.UserRole.USER,
                User.UserStatus.ACTIVE, now.minusDays(lifecycleProperties.getInactiveAfterDays()),
                User.UserStatus.EXPIRED, now.minusDays(lifecycleProperties.getExpiredReengageAfterDays()));

        int contacted = 0;
        int skipped = 0;
        int failed = 0;
        for (User user : candidates) {
            try {
                String text = user.getStatus() == User.UserStatus.EXPIRED
                        ? NotificationMessages.reengagementExpired()
                        : NotificationMessages.reengagementActive();
                if (userMessenger.send(user, OutboundMessage.plain(text)).isDelivered()) {
                    contacted++;
                } else {
                    skipped++;
                }
            } catch (Exception e) {
                failed++;
                log.error("Re-engagement of user {} failed: {}", user.getTelegramId(), e.getMessage(), e);
            }
        }

        JobReport report = new JobReport(LifecycleJob.INACTIVE_USERS, candidates.size(), contacted, skipped, failed);
        if (contacted > 0) {
            log.info("Inactive user run: {} re-engagement messages sent", contacted);
        }
        lifecycleMetrics.record(sample, report);
        return report;
    }
}
