package com.memberguard.backend.services;

import com.memberguard.backend.TestFixtures;
import com.memberguard.backend.config.LifecycleProperties;
import com.memberguard.backend.integrations.OutboundMessage;
import com.memberguard.backend.models.AuditLog;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.SubscriptionRepository;
import com.memberguard.backend.repositories.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static com.memberguard.backend.TestFixtures.NOW_ODT;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReferralServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private UserMessenger userMessenger;

    @Mock
    private AuditService auditService;

    private ReferralService referralService;

    private User referrer;
    private User referee;

    @BeforeEach
    void setUp() {
        referralService = new ReferralService(
                userRepository,
                subscriptionRepository,
                userMessenger,
                auditService,
                new LifecycleProperties(),
                TestFixtures.CLOCK
        );

        referrer = TestFixtures.user(100L);
        referee = TestFixtures.user(200L);
    }

    @Test
    void awardReferralBonus_ExtendsReferrerByBonusDays() {
        referee.setReferredBy(referrer);
        Subscription referrerSub = TestFixtures.subscription(1L, referrer, Subscription.SubscriptionStatus.ACTIVE, NOW_ODT.plusDays(5));
        when(subscriptionRepository.countByUser(referee)).thenReturn(1L);
        when(subscriptionRepository.findFirstByUserAndStatusAndExpiryDateAfter(referrer, Subscription.SubscriptionStatus.ACTIVE, NOW_ODT))
                .thenReturn(Optional.of(referrerSub));

        ReferralService.BonusOutcome outcome = referralService.awardReferralBonus(referee);
        ReferralService.BonusOutcome again = referralService.awardReferralBonus(referee);

        assertThat(outcome).isEqualTo(ReferralService.BonusOutcome.AWARDED);
        assertThat(again).isEqualTo(ReferralService.BonusOutcome.NOT_ELIGIBLE);
        assertThat(referrerSub.getExpiryDate()).isEqualTo(NOW_ODT.plusDays(8));
        assertThat(referee.isReferralBonusApplied()).isTrue();

        verify(subscriptionRepository, times(1)).save(referrerSub);
        verify(userMessenger).send(eq(referrer), any(OutboundMessage.class));
        verify(auditService, times(1)).recordSystem(eq(AuditLog.ActionType.REFERRAL_BONUS), eq(100L),
                argThat(details -> "AWARDED".equals(details.get("outcome"))));
    }

    @Test
    void awardReferralBonus_DroppedWhenReferrerHasNoActiveSubscription() {
        referee.setReferredBy(referrer);
        when(subscriptionRepository.countByUser(referee)).thenReturn(1L);
        when(subscriptionRepository.findFirstByUserAndStatusAndExpiryDateAfter(referrer, Subscription.SubscriptionStatus.ACTIVE, NOW_ODT))
                .thenReturn(Optional.empty());

        ReferralService.BonusOutcome outcome = referralService.awardReferralBonus(referee);

        assertThat(outcome).isEqualTo(ReferralService.BonusOutcome.DROPPED);
        assertThat(referee.isReferralBonusApplied()).isTrue();
        verify(subscriptionRepository, never()).save(any());
        verify(userMessenger, never()).send(any(User.class), any(OutboundMessage.class));
        verify(auditService).recordSystem(eq(AuditLog.ActionType.REFERRAL_BONUS), eq(100L),
                argThat(details -> "DROPPED".equals(details.get("outcome"))));
    }

    @Test
    void awardReferralBonus_OnlyForFirstSubscription() {
        referee.setReferredBy(referrer);
        when(subscriptionRepository.countByUser(referee)).thenReturn(2L);

        assertThat(referralService.awardReferralBonus(referee)).isEqualTo(ReferralService.BonusOutcome.NOT_ELIGIBLE);
        assertThat(referee.isReferralBonusApplied()).isFalse();
        verifyNoInteractions(auditService, userMessenger);
    }

    @Test
    void awardReferralBonus_UnreferredUserIsNotEligible() {
        assertThat(referralService.awardReferralBonus(referee)).isEqualTo(ReferralService.BonusOutcome.NOT_ELIGIBLE);
        verifyNoInteractions(subscriptionRepository, auditService);
    }

    @Test
    void attachReferrer_LinksOwnerOfCode() {
        when(userRepository.findByReferralCode("REF100")).thenReturn(Optional.of(referrer));

        assertThat(referralService.attachReferrer(referee, " ref100 ")).isTrue();
        assertThat(referee.getReferredBy()).isSameAs(referrer);
        verify(userRepository).save(referee);
    }

    @Test
    void attachReferrer_IgnoresUnknownOwnOrSecondCode() {
        when(userRepository.findByReferralCode("NOPE1234")).thenReturn(Optional.empty());
        when(userRepository.findByReferralCode("REF200")).thenReturn(Optional.of(referee));

        assertThat(referralService.attachReferrer(referee, "NOPE1234")).isFalse();
        assertThat(referralService.attachReferrer(referee, "REF200")).isFalse();
        assertThat(referralService.attachReferrer(referee, null)).isFalse();

        referee.setReferredBy(referrer);
        assertThat(referralService.attachReferrer(referee, "REF300")).isFalse();

        assertThat(referee.getReferredBy()).isSameAs(referrer);
        verify(userRepository, never()).save(any());
    }
}
