package com.memberguard.backend.services;

import com.memberguard.backend.integrations.NotificationGateway;
import com.memberguard.backend.models.AuditLog;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * The only place where a user becomes BLOCKED: a delivery reported the recipient unreachable.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BlockedRecipientHandler {

    static final String REASON = "recipient blocked";

    private final UserRepository userRepository;
    private final AuditService auditService;
    private final NotificationGateway notificationGateway;

    public void handle(long telegramId) {
        try {
            userRepository.findByTelegramId(telegramId).ifPresent(user -> {
                user.setBlocked(true);
                user.setStatus(User.UserStatus.BLOCKED);
                userRepository.save(user);
            });

            auditService.recordSystem(AuditLog.ActionType.USER_BLOCKED, telegramId, Map.of("reason", REASON));

            notificationGateway.alertOperators(NotificationMessages.blockedAlert(telegramId));

            log.warn("User {} has blocked the bot, marked as blocked", telegramId);
        } catch (Exception e) {
            // The caller already knows the delivery failed; this only loses the bookkeeping
            log.error("Failed to record blocked recipient {}: {}", telegramId, e.getMessage(), e);
        }
    }
}
