package com.memberguard.backend.services;

import com.memberguard.backend.exceptions.ResourceNotFoundException;
import com.memberguard.backend.models.AccessRequest;
import com.memberguard.backend.models.User;
import com.memberguard.backend.repositories.AccessRequestRepository;
import com.memberguard.backend.repositories.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class AccessRequestService {

    private final AccessRequestRepository accessRequestRepository;
    private final UserRepository userRepository;
    private final SubscriptionService subscriptionService;
    private final UserMessenger userMessenger;
    private final Clock clock;

    /**
     * One pending request per user: a repeated submission returns the open one.
     * A request from a user with a live subscription is a renewal.
     */
    @Transactional
    public AccessRequest submit(long telegramId, Long planId) {
        User user = userRepository.findByTelegramId(telegramId)
                .orElseThrow(() -> new ResourceNotFoundException("User", telegramId));

        Optional<AccessRequest> open = accessRequestRepository.findFirstByUserAndStatus(user, AccessRequest.RequestStatus.PENDING);
        if (open.isPresent()) {
            log.debug("User {} already has pending request {}", telegramId, open.get().getId());
            return open.get();
        }

        boolean renewal = subscriptionService.findLive(user).isPresent();
        AccessRequest request = AccessRequest.builder()
                .user(user)
                .status(AccessRequest.RequestStatus.PENDING)
                .requestDate(OffsetDateTime.now(clock))
                .selectedPlanId(planId)
                .renewal(renewal)
                .build();
        accessRequestRepository.save(request);

        if (!renewal) {
            user.setStatus(User.UserStatus.PENDING);
        }
        user.setLastInteraction(OffsetDateTime.now(clock));
        userRepository.save(user);

        userMessenger.alertOperators(NotificationMessages.accessRequestAlert(user, renewal));
        log.info("Access request from user {} (renewal: {})", telegramId, renewal);
        return request;
    }

    @Transactional(readOnly = true)
    public List<AccessRequest> listPending() {
        return accessRequestRepository.findByStatusOrderByRequestDateAsc(AccessRequest.RequestStatus.PENDING);
    }
}
