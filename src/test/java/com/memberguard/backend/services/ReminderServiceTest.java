package com.memberguard.backend.services;

import com.memberguard.backend.TestFixtures;
import com.memberguard.backend.integrations.DeliveryResult;
import com.memberguard.backend.integrations.OutboundMessage;
import com.memberguard.backend.lifecycle.JobReport;
import com.memberguard.backend.models.Plan;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.PlanRepository;
import com.memberguard.backend.repositories.SubscriptionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.memberguard.backend.TestFixtures.NOW_ODT;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReminderServiceTest {

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private PlanRepository planRepository;

    @Mock
    private UserMessenger userMessenger;

    private final MeterRegistry meterRegistry = new SimpleMeterRegistry();

    private ReminderService reminderService;

    private User user;
    private Plan plan;

    @BeforeEach
    void setUp() {
        reminderService = new ReminderService(
                subscriptionRepository,
                planRepository,
                userMessenger,
                new LifecycleMetrics(meterRegistry),
                TestFixtures.CLOCK
        );

        user = TestFixtures.user(100L);
        plan = TestFixtures.plan(1L, 30);
    }

    @Test
    void runReminders_SendsSevenDayReminderOnceAndSetsLatch() {
        Subscription subscription = TestFixtures.subscription(1L, user, Subscription.SubscriptionStatus.ACTIVE, NOW_ODT.plusDays(7));
        when(subscriptionRepository.findByStatusAndExpiryDateBetween(eq(Subscription.SubscriptionStatus.ACTIVE), any(), any()))
                .thenReturn(List.of(subscription));
        when(planRepository.findByActiveTrueOrderByDurationDaysAsc()).thenReturn(List.of(plan));
        when(userMessenger.send(eq(user), any(OutboundMessage.class))).thenReturn(DeliveryResult.DELIVERED);

        JobReport first = reminderService.runReminders();
        JobReport rerun = reminderService.runReminders();

        assertThat(first.candidates()).isEqualTo(1);
        assertThat(first.succeeded()).isEqualTo(1);
        assertThat(subscription.getReminderFlags().isDay7()).isTrue();
        assertThat(subscription.getReminderFlags().isDay3()).isFalse();
        assertThat(rerun.candidates()).isZero();

        ArgumentCaptor<OutboundMessage> message = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(userMessenger, times(1)).send(eq(user), message.capture());
        assertThat(message.getValue().text()).contains("7 days").contains("17/06/2024");
        assertThat(message.getValue().renewalOptions()).containsExactly(plan);
        verify(subscriptionRepository, times(1)).save(subscription);

        assertThat(meterRegistry.get("lifecycle.job.runs").tag("job", "reminders").counter().count()).isEqualTo(2.0);
    }

    @Test
    void runReminders_UnreachableLeavesLatchUnset() {
        Subscription subscription = TestFixtures.subscription(1L, user, Subscription.SubscriptionStatus.ACTIVE, NOW_ODT.plusDays(3));
        when(subscriptionRepository.findByStatusAndExpiryDateBetween(eq(Subscription.SubscriptionStatus.ACTIVE), any(), any()))
                .thenReturn(List.of(subscription));
        when(planRepository.findByActiveTrueOrderByDurationDaysAsc()).thenReturn(List.of(plan));
        when(userMessenger.send(eq(user), any(OutboundMessage.class))).thenReturn(DeliveryResult.UNREACHABLE);

        JobReport report = reminderService.runReminders();

        assertThat(report.skipped()).isEqualTo(1);
        assertThat(subscription.getReminderFlags().isDay3()).isFalse();
        verify(subscriptionRepository, never()).save(any());
    }

    @Test
    void runReminders_TransientErrorIsNotRetriedAtNextCheckpoint() {
        Subscription subscription = TestFixtures.subscription(1L, user, Subscription.SubscriptionStatus.ACTIVE, NOW_ODT.plusDays(1));
        when(subscriptionRepository.findByStatusAndExpiryDateBetween(eq(Subscription.SubscriptionStatus.ACTIVE), any(), any()))
                .thenReturn(List.of(subscription));
        when(planRepository.findByActiveTrueOrderByDurationDaysAsc()).thenReturn(List.of(plan));
        when(userMessenger.send(eq(user), any(OutboundMessage.class))).thenReturn(DeliveryResult.TRANSIENT_ERROR);

        JobReport report = reminderService.runReminders();

        // Only the 1-day checkpoint applies; the missed 3-day one is not sent late
        assertThat(report.candidates()).isEqualTo(1);
        assertThat(subscription.getReminderFlags().isDay1()).isFalse();
        assertThat(subscription.getReminderFlags().isDay3()).isFalse();
        verify(userMessenger, times(1)).send(eq(user), any(OutboundMessage.class));
    }

    @Test
    void runReminders_OneFailureDoesNotStopOthers() {
        User other = TestFixtures.user(200L);
        Subscription failing = TestFixtures.subscription(1L, user, Subscription.SubscriptionStatus.ACTIVE, NOW_ODT.plusDays(7));
        Subscription healthy = TestFixtures.subscription(2L, other, Subscription.SubscriptionStatus.ACTIVE, NOW_ODT);
        when(subscriptionRepository.findByStatusAndExpiryDateBetween(eq(Subscription.SubscriptionStatus.ACTIVE), any(), any()))
                .thenReturn(List.of(failing, healthy));
        when(planRepository.findByActiveTrueOrderByDurationDaysAsc()).thenReturn(List.of(plan));
        when(userMessenger.send(eq(user), any(OutboundMessage.class))).thenThrow(new RuntimeException("boom"));
        when(userMessenger.send(eq(other), any(OutboundMessage.class))).thenReturn(DeliveryResult.DELIVERED);

        JobReport report = reminderService.runReminders();

        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.succeeded()).isEqualTo(1);
        assertThat(healthy.getReminderFlags().isDay0()).isTrue();
        assertThat(failing.getReminderFlags().isDay7()).isFalse();
    }

    @Test
    void runReminders_NothingDue() {
        when(subscriptionRepository.findByStatusAndExpiryDateBetween(eq(Subscription.SubscriptionStatus.ACTIVE), any(), any()))
                .thenReturn(List.of());

        JobReport report = reminderService.runReminders();

        assertThat(report).isEqualTo(JobReport.empty(report.job()));
        verifyNoInteractions(planRepository, userMessenger);
    }
}
