package com.memberguard.backend.services;

import com.memberguard.backend.config.LifecycleProperties;
import com.memberguard.backend.integrations.OutboundMessage;
import com.memberguard.backend.models.AuditLog;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.SubscriptionRepository;
import com.memberguard.backend.repositories.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Referral program: linking a new user to a referrer, and the one-time bonus paid to the
 * referrer when the referred user's first subscription is approved.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferralService {

    private final UserRepository userRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final UserMessenger userMessenger;
    private final AuditService auditService;
    private final LifecycleProperties lifecycleProperties;
    private final Clock clock;

    public enum BonusOutcome {
        /** Not referred, already settled, or not the first subscription */
        NOT_ELIGIBLE,
        AWARDED,
        /** Referrer had no active subscription to extend */
        DROPPED
    }

    /**
     * Links the user to the owner of the code. Ignored when the user already has a referrer,
     * the code is unknown, or the code is the user's own.
     *
     * @return true when the link was made
     */
    public boolean attachReferrer(User user, String referralCode) {
        if (referralCode == null || referralCode.isBlank()) {
            return false;
        }
        if (user.hasReferrer()) {
            log.debug("User {} already referred, ignoring code {}", user.getTelegramId(), referralCode);
            return false;
        }

        String code = referralCode.trim().toUpperCase(Locale.ROOT);
        Optional<User> referrer = userRepository.findByReferralCode(code);
        if (referrer.isEmpty()) {
            log.debug("Unknown referral code {} from user {}", code, user.getTelegramId());
            return false;
        }
        if (referrer.get().getTelegramId().equals(user.getTelegramId())) {
            log.debug("User {} tried to use their own referral code", user.getTelegramId());
            return false;
        }

        user.setReferredBy(referrer.get());
        userRepository.save(user);
        log.info("User {} referred by {}", user.getTelegramId(), referrer.get().getTelegramId());
        return true;
    }

    /**
     * Called right after an approval. The referral flag is set and audited whenever the user is
     * eligible, whether or not the referrer could actually be credited.
     * Runs in its own transaction; the approval that triggers it has already committed.
     */
    @Transactional
    public BonusOutcome awardReferralBonus(User approvedUser) {
        User referee = userRepository.findById(approvedUser.getId()).orElse(approvedUser);
        if (!referee.hasReferrer() || referee.isReferralBonusApplied()) {
            return BonusOutcome.NOT_ELIGIBLE;
        }
        if (subscriptionRepository.countByUser(referee) != 1) {
            return BonusOutcome.NOT_ELIGIBLE;
        }

        User referrer = referee.getReferredBy();
        OffsetDateTime now = OffsetDateTime.now(clock);
        int bonusDays = lifecycleProperties.getReferralBonusDays();

        Optional<Subscription> target = subscriptionRepository.findFirstByUserAndStatusAndExpiryDateAfter(
                referrer, Subscription.SubscriptionStatus.ACTIVE, now);

        BonusOutcome outcome;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("refereeId", referee.getTelegramId());
        details.put("bonusDays", bonusDays);

        if (target.isPresent()) {
            Subscription subscription = target.get();
            OffsetDateTime previousExpiry = subscription.getExpiryDate();
            subscription.setExpiryDate(previousExpiry.plusDays(bonusDays));
            subscriptionRepository.save(subscription);

            details.put("subscriptionId", subscription.getId());
            details.put("previousExpiry", previousExpiry.toString());
            details.put("newExpiry", subscription.getExpiryDate().toString());
            outcome = BonusOutcome.AWARDED;

            ZoneId zone = clock.getZone();
            userMessenger.send(referrer, OutboundMessage.plain(
                    NotificationMessages.referralBonus(referee, bonusDays, subscription, zone)));
            log.info("Referral bonus of {} days awarded to {} for referring {}",
                    bonusDays, referrer.getTelegramId(), referee.getTelegramId());
        } else {
            outcome = BonusOutcome.DROPPED;
            log.info("Referral bonus for {} dropped: referrer {} has no active subscription",
                    referee.getTelegramId(), referrer.getTelegramId());
        }
        details.put("outcome", outcome.name());

        referee.setReferralBonusApplied(true);
        userRepository.save(referee);

        auditService.recordSystem(AuditLog.ActionType.REFERRAL_BONUS, referrer.getTelegramId(), details);
        userMessenger.alertOperators(NotificationMessages.referralBonusAlert(referrer, referee, outcome == BonusOutcome.AWARDED));
        return outcome;
    }
}
