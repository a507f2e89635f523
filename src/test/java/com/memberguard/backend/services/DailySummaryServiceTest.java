package com.memberguard.backend.services;

import com.memberguard.backend.TestFixtures;
import com.memberguard.backend.models.AccessRequest;
import com.memberguard.backend.models.AuditLog;
import com.memberguard.backend.models.DailySummary;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.repositories.AccessRequestRepository;
import com.memberguard.backend.repositories.AuditLogRepository;
import com.memberguard.backend.repositories.DailySummaryRepository;
import com.memberguard.backend.repositories.SubscriptionRepository;
import com.memberguard.backend.repositories.UserRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DailySummaryServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 10);
    private static final OffsetDateTime START = OffsetDateTime.parse("2024-06-10T00:00:00Z");

    @Mock
    private UserRepository userRepository;

    @Mock
    private AccessRequestRepository accessRequestRepository;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private AuditLogRepository auditLogRepository;

    @Mock
    private DailySummaryRepository dailySummaryRepository;

    @Mock
    private UserMessenger userMessenger;

    private DailySummaryService dailySummaryService;

    @BeforeEach
    void setUp() {
        dailySummaryService = new DailySummaryService(userRepository, accessRequestRepository, subscriptionRepository,
                auditLogRepository, dailySummaryRepository, userMessenger,
                new LifecycleMetrics(new SimpleMeterRegistry()), TestFixtures.CLOCK);
    }

    @Test
    void runDailySummary_UpsertsExistingRowAndPostsIt() {
        DailySummary existing = DailySummary.builder().id(3L).date(TODAY).newUsers(1).build();
        when(dailySummaryRepository.findByDate(TODAY)).thenReturn(Optional.of(existing));
        when(userRepository.countByCreatedAtBetween(eq(START), any())).thenReturn(4L);
        when(accessRequestRepository.countByRequestDateBetween(eq(START), any())).thenReturn(3L);
        when(accessRequestRepository.countByStatusAndActionDateBetween(eq(AccessRequest.RequestStatus.APPROVED), eq(START), any()))
                .thenReturn(2L);
        when(accessRequestRepository.countByStatusAndRenewalTrueAndActionDateBetween(
                eq(AccessRequest.RequestStatus.APPROVED), eq(START), any())).thenReturn(1L);
        when(subscriptionRepository.countByStatusAndUpdatedAtBetween(eq(Subscription.SubscriptionStatus.EXPIRED), eq(START), any()))
                .thenReturn(5L);
        when(auditLogRepository.countByActionTypeAndTimestampBetween(eq(AuditLog.ActionType.BAN_USER), eq(START), any()))
                .thenReturn(6L);
        when(auditLogRepository.countByActionTypeAndTimestampBetween(eq(AuditLog.ActionType.BROADCAST), eq(START), any()))
                .thenReturn(0L);

        dailySummaryService.runDailySummary();

        assertThat(existing.getNewUsers()).isEqualTo(4);
        assertThat(existing.getRequestsReceived()).isEqualTo(3);
        assertThat(existing.getApprovals()).isEqualTo(2);
        assertThat(existing.getRenewals()).isEqualTo(1);
        assertThat(existing.getExpiredToday()).isEqualTo(5);
        assertThat(existing.getRemovedFromGroup()).isEqualTo(6);
        verify(dailySummaryRepository).save(existing);
        verify(userMessenger).alertOperators(contains("Removed from group: 6"));
    }
}
