package com.memberguard.backend.services;

import com.memberguard.backend.TestFixtures;
import com.memberguard.backend.config.LifecycleProperties;
import com.memberguard.backend.integrations.DeliveryResult;
import com.memberguard.backend.integrations.OutboundMessage;
import com.memberguard.backend.lifecycle.JobReport;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.UserRepository;
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
class InactiveUserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private UserMessenger userMessenger;

    private InactiveUserService inactiveUserService;

    @BeforeEach
    void setUp() {
        inactiveUserService = new InactiveUserService(userRepository, userMessenger,
                new LifecycleMetrics(new SimpleMeterRegistry()), new LifecycleProperties(), TestFixtures.CLOCK);
    }

    @Test
    void runInactiveUsers_MessagesQuietAndLapsedUsers() {
        User quiet = TestFixtures.user(100L);
        User lapsed = TestFixtures.user(200L);
        lapsed.setStatus(User.UserStatus.EXPIRED);
        when(userRepository.findReengagementCandidates(User.UserRole.USER,
                User.UserStatus.ACTIVE, NOW_ODT.minusDays(30),
                User.UserStatus.EXPIRED, NOW_ODT.minusDays(7)))
                .thenReturn(List.of(quiet, lapsed));
        when(userMessenger.send(eq(quiet), any(OutboundMessage.class))).thenReturn(DeliveryResult.DELIVERED);
        when(userMessenger.send(eq(lapsed), any(OutboundMessage.class))).thenReturn(DeliveryResult.TRANSIENT_ERROR);

        JobReport report = inactiveUserService.runInactiveUsers();

        assertThat(report.candidates()).isEqualTo(2);
        assertThat(report.succeeded()).isEqualTo(1);
        assertThat(report.skipped()).isEqualTo(1);

        ArgumentCaptor<OutboundMessage> message = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(userMessenger).send(eq(lapsed), message.capture());
        assertThat(message.getValue().text()).contains("Request access again");
    }
}
