package com.memberguard.backend.services;

import com.memberguard.backend.TestFixtures;
import com.memberguard.backend.exceptions.ResourceNotFoundException;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.AccessRequestRepository;
import com.memberguard.backend.repositories.SubscriptionRepository;
import com.memberguard.backend.repositories.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static com.memberguard.backend.TestFixtures.NOW_ODT;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private AccessRequestRepository accessRequestRepository;

    @Mock
    private ReferralService referralService;

    private UserService userService;

    @BeforeEach
    void setUp() {
        userService = new UserService(userRepository, subscriptionRepository, accessRequestRepository,
                referralService, TestFixtures.CLOCK);
    }

    @Test
    void registerContact_CreatesUserAndAttachesReferral() {
        when(userRepository.findByTelegramId(300L)).thenReturn(Optional.empty());
        when(referralService.attachReferrer(any(User.class), eq("REF100"))).thenReturn(true);

        UserService.ContactResult result = userService.registerContact(300L, "Alice", "alice", "REF100");

        assertThat(result.created()).isTrue();
        assertThat(result.referred()).isTrue();
        assertThat(result.user().getTelegramId()).isEqualTo(300L);
        assertThat(result.user().getStatus()).isEqualTo(User.UserStatus.INACTIVE);
        assertThat(result.user().getLastInteraction()).isEqualTo(NOW_ODT);
        assertThat(result.user().getReferralCode()).hasSize(8);

        ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(saved.capture());
        assertThat(saved.getValue().getName()).isEqualTo("Alice");
    }

    @Test
    void registerContact_ExistingUserIgnoresReferralCode() {
        User existing = TestFixtures.user(100L);
        when(userRepository.findByTelegramId(100L)).thenReturn(Optional.of(existing));

        UserService.ContactResult result = userService.registerContact(100L, "Renamed", "renamed", "REF200");

        assertThat(result.created()).isFalse();
        assertThat(existing.getName()).isEqualTo("Renamed");
        assertThat(existing.getUsername()).isEqualTo("renamed");
        verifyNoInteractions(referralService);
    }

    @Test
    void registerContact_LiftsBlockWhenUserWritesAgain() {
        User blocked = TestFixtures.user(100L);
        blocked.setBlocked(true);
        blocked.setStatus(User.UserStatus.BLOCKED);
        when(userRepository.findByTelegramId(100L)).thenReturn(Optional.of(blocked));
        when(subscriptionRepository.existsByUserAndStatusIn(blocked, Subscription.LIVE_STATUSES)).thenReturn(true);

        userService.registerContact(100L, "User 100", "user100", null);

        assertThat(blocked.isBlocked()).isFalse();
        assertThat(blocked.getStatus()).isEqualTo(User.UserStatus.ACTIVE);
    }

    @Test
    void getByTelegramId_UnknownUser() {
        when(userRepository.findByTelegramId(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> userService.getByTelegramId(1L))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
