package com.memberguard.backend.services;

import com.memberguard.backend.dto.GrowthStatsDto;
import com.memberguard.backend.exceptions.ResourceNotFoundException;
import com.memberguard.backend.lifecycle.LifecycleDates;
import com.memberguard.backend.models.AccessRequest;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.AccessRequestRepository;
import com.memberguard.backend.repositories.SubscriptionRepository;
import com.memberguard.backend.repositories.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final AccessRequestRepository accessRequestRepository;
    private final ReferralService referralService;
    private final Clock clock;

    public record ContactResult(User user, boolean created, boolean referred) {
    }

    /**
     * Find-or-create on every contact. Refreshes profile fields and the interaction time.
     * A user who had blocked the bot and writes again is reachable, so the block is lifted.
     * A referral code only counts on the very first contact.
     */
    @Transactional
    public ContactResult registerContact(long telegramId, String name, String username, String referralCode) {
        OffsetDateTime now = OffsetDateTime.now(clock);

        User user = userRepository.findByTelegramId(telegramId).orElse(null);
        boolean created = user == null;
        if (created) {
            user = User.builder()
                    .telegramId(telegramId)
                    .name(name)
                    .username(username)
                    .lastInteraction(now)
                    .build();
            log.info("New user {} ({})", telegramId, name);
        } else {
            user.setName(name);
            user.setUsername(username);
            user.setLastInteraction(now);
            if (user.isBlocked()) {
                user.setBlocked(false);
                user.setStatus(statusAfterUnblock(user));
                log.info("User {} contacted the bot again, block lifted", telegramId);
            }
        }
        userRepository.save(user);

        boolean referred = created && referralService.attachReferrer(user, referralCode);
        return new ContactResult(user, created, referred);
    }

    @Transactional(readOnly = true)
    public User getByTelegramId(long telegramId) {
        return userRepository.findByTelegramId(telegramId)
                .orElseThrow(() -> new ResourceNotFoundException("User", telegramId));
    }

    @Transactional(readOnly = true)
    public GrowthStatsDto growthStats() {
        LocalDate today = LocalDate.now(clock);
        ZoneId zone = clock.getZone();

        return GrowthStatsDto.builder()
                .totalUsers(userRepository.countByRole(User.UserRole.USER))
                .activeUsers(userRepository.countByStatus(User.UserStatus.ACTIVE))
                .expiredUsers(userRepository.countByStatus(User.UserStatus.EXPIRED))
                .pendingUsers(userRepository.countByStatus(User.UserStatus.PENDING))
                .blockedUsers(userRepository.countByBlockedTrue())
                .newToday(userRepository.countByCreatedAtBetween(
                        LifecycleDates.startOfDay(today, zone), LifecycleDates.endOfDay(today, zone)))
                .activeSubscriptions(subscriptionRepository.countByStatus(Subscription.SubscriptionStatus.ACTIVE))
                .graceSubscriptions(subscriptionRepository.countByStatus(Subscription.SubscriptionStatus.GRACE))
                .pendingRequests(accessRequestRepository.countByStatus(AccessRequest.RequestStatus.PENDING))
                .build();
    }

    private User.UserStatus statusAfterUnblock(User user) {
        if (subscriptionRepository.existsByUserAndStatusIn(user, Subscription.LIVE_STATUSES)) {
            return User.UserStatus.ACTIVE;
        }
        return subscriptionRepository.countByUser(user) > 0 ? User.UserStatus.EXPIRED : User.UserStatus.INACTIVE;
    }
}
