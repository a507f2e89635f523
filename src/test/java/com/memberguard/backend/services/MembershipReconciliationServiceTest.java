package com.memberguard.backend.services;

import com.memberguard.backend.TestFixtures;
import com.memberguard.backend.config.LifecycleProperties;
import com.memberguard.backend.integrations.GroupMembershipException;
import com.memberguard.backend.integrations.GroupMembershipProvider;
import com.memberguard.backend.integrations.OutboundMessage;
import com.memberguard.backend.lifecycle.JobReport;
import com.memberguard.backend.models.AuditLog;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.SubscriptionRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.memberguard.backend.TestFixtures.NOW_ODT;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MembershipReconciliationServiceTest {

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private GroupMembershipProvider groupMembershipProvider;

    @Mock
    private UserMessenger userMessenger;

    @Mock
    private AuditService auditService;

    private MembershipReconciliationService reconciliationService;

    private User subscriber;
    private User lapsed;

    @BeforeEach
    void setUp() {
        reconciliationService = new MembershipReconciliationService(
                subscriptionRepository,
                groupMembershipProvider,
                userMessenger,
                auditService,
                new LifecycleMetrics(new SimpleMeterRegistry()),
                new LifecycleProperties(),
                TestFixtures.CLOCK
        );

        subscriber = TestFixtures.user(100L);
        lapsed = TestFixtures.user(200L);
    }

    @Test
    void runReconciliation_InvitesActiveSubscriberMissingFromGroup() throws Exception {
        Subscription active = TestFixtures.subscription(1L, subscriber, Subscription.SubscriptionStatus.ACTIVE, NOW_ODT.plusDays(10));
        when(subscriptionRepository.findByStatusAndExpiryDateAfter(Subscription.SubscriptionStatus.ACTIVE, NOW_ODT))
                .thenReturn(List.of(active));
        when(subscriptionRepository.findByStatusIn(Subscription.TERMINAL_STATUSES)).thenReturn(List.of());
        when(groupMembershipProvider.isMember(100L)).thenReturn(false);
        when(groupMembershipProvider.createSingleUseInvite(100L, 600)).thenReturn("https://t.me/+invite");

        JobReport report = reconciliationService.runReconciliation();

        assertThat(report.succeeded()).isEqualTo(1);
        ArgumentCaptor<OutboundMessage> message = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(userMessenger).send(eq(subscriber), message.capture());
        assertThat(message.getValue().text()).contains("https://t.me/+invite").contains("10 minutes");
    }

    @Test
    void runReconciliation_MemberLookupFailureSkipsCandidate() throws Exception {
        Subscription active = TestFixtures.subscription(1L, subscriber, Subscription.SubscriptionStatus.ACTIVE, NOW_ODT.plusDays(10));
        when(subscriptionRepository.findByStatusAndExpiryDateAfter(Subscription.SubscriptionStatus.ACTIVE, NOW_ODT))
                .thenReturn(List.of(active));
        when(subscriptionRepository.findByStatusIn(Subscription.TERMINAL_STATUSES)).thenReturn(List.of());
        when(groupMembershipProvider.isMember(100L)).thenThrow(new GroupMembershipException("timeout"));

        JobReport report = reconciliationService.runReconciliation();

        assertThat(report.skipped()).isEqualTo(1);
        verify(groupMembershipProvider, never()).createSingleUseInvite(anyLong(), anyInt());
        verifyNoInteractions(userMessenger);
    }

    @Test
    void runReconciliation_RemovesLapsedMemberOncePerUser() throws Exception {
        Subscription expired = TestFixtures.subscription(2L, lapsed, Subscription.SubscriptionStatus.EXPIRED, NOW_ODT.minusDays(20));
        Subscription cancelled = TestFixtures.subscription(3L, lapsed, Subscription.SubscriptionStatus.CANCELLED, NOW_ODT.minusDays(60));
        when(subscriptionRepository.findByStatusAndExpiryDateAfter(Subscription.SubscriptionStatus.ACTIVE, NOW_ODT))
                .thenReturn(List.of());
        when(subscriptionRepository.findByStatusIn(Subscription.TERMINAL_STATUSES)).thenReturn(List.of(expired, cancelled));
        when(subscriptionRepository.existsByUserAndStatusIn(lapsed, Subscription.LIVE_STATUSES)).thenReturn(false);
        when(groupMembershipProvider.isMember(200L)).thenReturn(true);
        when(groupMembershipProvider.removeMember(200L)).thenReturn(true);

        JobReport report = reconciliationService.runReconciliation();

        assertThat(report.candidates()).isEqualTo(1);
        assertThat(report.succeeded()).isEqualTo(1);
        verify(groupMembershipProvider, times(1)).isMember(200L);
        verify(auditService).recordSystem(AuditLog.ActionType.BAN_USER, 200L, Map.of("reason", "removed by reconciler"));
        verify(userMessenger).alertOperators(contains("removed by reconciler"));
    }

    @Test
    void runReconciliation_NeverRemovesUserWithLiveSubscription() throws Exception {
        Subscription oldExpired = TestFixtures.subscription(2L, subscriber, Subscription.SubscriptionStatus.EXPIRED, NOW_ODT.minusDays(40));
        Subscription current = TestFixtures.subscription(4L, subscriber, Subscription.SubscriptionStatus.ACTIVE, NOW_ODT.plusDays(20));
        when(subscriptionRepository.findByStatusAndExpiryDateAfter(Subscription.SubscriptionStatus.ACTIVE, NOW_ODT))
                .thenReturn(List.of(current));
        when(subscriptionRepository.findByStatusIn(Subscription.TERMINAL_STATUSES)).thenReturn(List.of(oldExpired));
        when(subscriptionRepository.existsByUserAndStatusIn(subscriber, Subscription.LIVE_STATUSES)).thenReturn(true);
        when(groupMembershipProvider.isMember(100L)).thenReturn(true);

        reconciliationService.runReconciliation();

        verify(groupMembershipProvider, never()).removeMember(anyLong());
        verifyNoInteractions(auditService);
    }

    @Test
    void runReconciliation_LapsedNonMemberIsInSync() throws Exception {
        Subscription expired = TestFixtures.subscription(2L, lapsed, Subscription.SubscriptionStatus.EXPIRED, NOW_ODT.minusDays(20));
        when(subscriptionRepository.findByStatusAndExpiryDateAfter(Subscription.SubscriptionStatus.ACTIVE, NOW_ODT))
                .thenReturn(List.of());
        when(subscriptionRepository.findByStatusIn(Subscription.TERMINAL_STATUSES)).thenReturn(List.of(expired));
        when(subscriptionRepository.existsByUserAndStatusIn(lapsed, Subscription.LIVE_STATUSES)).thenReturn(false);
        when(groupMembershipProvider.isMember(200L)).thenReturn(false);

        JobReport report = reconciliationService.runReconciliation();

        assertThat(report.succeeded()).isZero();
        assertThat(report.failed()).isZero();
        verify(groupMembershipProvider, never()).removeMember(anyLong());
    }
}
