package com.memberguard.backend.services;

import com.memberguard.backend.integrations.DeliveryResult;
import com.memberguard.backend.integrations.NotificationGateway;
import com.memberguard.backend.integrations.OutboundMessage;
import com.memberguard.backend.models.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Delivery front door for every engine and for broadcasts.
 * Routes unreachable recipients to {@link BlockedRecipientHandler}; everything else is logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserMessenger {

    private final NotificationGateway notificationGateway;
    private final BlockedRecipientHandler blockedRecipientHandler;

    /**
     * Users already marked blocked are not contacted again until they reach out to the bot.
     * An unreachable recipient is also marked blocked on the given instance, so a caller that
     * saves it afterwards keeps the blocked state.
     */
    public DeliveryResult send(User user, OutboundMessage message) {
        if (user.isBlocked()) {
            log.debug("Skipping delivery to blocked user {}", user.getTelegramId());
            return DeliveryResult.UNREACHABLE;
        }
        DeliveryResult result = send(user.getTelegramId(), message);
        if (result == DeliveryResult.UNREACHABLE) {
            user.setBlocked(true);
            user.setStatus(User.UserStatus.BLOCKED);
        }
        return result;
    }

    public DeliveryResult send(long telegramId, OutboundMessage message) {
        DeliveryResult result = notificationGateway.deliver(telegramId, message);

        switch (result) {
            case DELIVERED -> log.debug("Delivered message to {}", telegramId);
            case UNREACHABLE -> blockedRecipientHandler.handle(telegramId);
            case TRANSIENT_ERROR -> log.warn("Delivery to {} failed transiently, not retried", telegramId);
        }
        return result;
    }

    public void alertOperators(String text) {
        notificationGateway.alertOperators(text);
    }
}
