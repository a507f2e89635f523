package com.memberguard.backend.services;

import com.memberguard.backend.config.LifecycleProperties;
import com.memberguard.backend.integrations.DeliveryResult;
import com.memberguard.backend.integrations.OutboundMessage;
import com.memberguard.backend.models.AuditLog;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin broadcast to a user segment. Sends are sequential with a fixed pause between them
 * to stay under the platform's rate limit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BroadcastService {

    private static final int AUDIT_PREVIEW_LENGTH = 100;

    private final UserRepository userRepository;
    private final UserMessenger userMessenger;
    private final AuditService auditService;
    private final LifecycleProperties lifecycleProperties;
    private final Clock clock;

    public enum BroadcastTarget {
        ALL,
        ACTIVE,
        EXPIRED,
        /** Joined within the last few days */
        NEW
    }

    public record BroadcastResult(BroadcastTarget target, int recipients, int sent, int failed) {
    }

    /**
     * Non-blocked regular users in the segment. Staff never receive broadcasts.
     */
    public List<User> recipients(BroadcastTarget target) {
        return switch (target) {
            case ALL -> userRepository.findByRoleAndBlockedFalse(User.UserRole.USER);
            case ACTIVE -> userRepository.findByRoleAndBlockedFalseAndStatus(User.UserRole.USER, User.UserStatus.ACTIVE);
            case EXPIRED -> userRepository.findByRoleAndBlockedFalseAndStatus(User.UserRole.USER, User.UserStatus.EXPIRED);
            case NEW -> userRepository.findByRoleAndBlockedFalseAndCreatedAtAfter(User.UserRole.USER,
                    OffsetDateTime.now(clock).minusDays(lifecycleProperties.getNewUserWindowDays()));
        };
    }

    public BroadcastResult broadcast(long adminId, BroadcastTarget target, String text) {
        List<User> recipients = recipients(target);
        OutboundMessage message = OutboundMessage.plain(text);
        long delayMs = lifecycleProperties.getBroadcastDelayMs();

        log.info("Broadcast by {} to {}: {} recipients", adminId, target, recipients.size());

        int sent = 0;
        int failed = 0;
        for (int i = 0; i < recipients.size(); i++) {
            if (i > 0 && delayMs > 0 && !pause(delayMs)) {
                failed += recipients.size() - i;
                log.warn("Broadcast to {} interrupted after {} of {} recipients", target, i, recipients.size());
                break;
            }

            User user = recipients.get(i);
            try {
                DeliveryResult result = userMessenger.send(user, message);
                if (result.isDelivered()) {
                    sent++;
                } else {
                    failed++;
                }
            } catch (Exception e) {
                failed++;
                log.error("Broadcast delivery to {} failed: {}", user.getTelegramId(), e.getMessage(), e);
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("target", target.name());
        details.put("sent", sent);
        details.put("failed", failed);
        details.put("message", text.length() > AUDIT_PREVIEW_LENGTH ? text.substring(0, AUDIT_PREVIEW_LENGTH) : text);
        auditService.record(adminId, AuditLog.ActionType.BROADCAST, null, details);

        userMessenger.alertOperators(NotificationMessages.broadcastAlert(target.name(), sent, failed));

        log.info("Broadcast to {} finished: {} sent, {} failed", target, sent, failed);
        return new BroadcastResult(target, recipients.size(), sent, failed);
    }

    /**
     * @return false when the thread was interrupted
     */
    private boolean pause(long delayMs) {
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
