package com.memberguard.backend.repositories;

import com.memberguard.backend.models.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByTelegramId(Long telegramId);

    Optional<User> findByReferralCode(String referralCode);

    long countByRole(User.UserRole role);

    long countByStatus(User.UserStatus status);

    long countByBlockedTrue();

    long countByCreatedAtBetween(OffsetDateTime start, OffsetDateTime end);

    /**
     * Broadcast audiences
     */
    List<User> findByRoleAndBlockedFalse(User.UserRole role);

    List<User> findByRoleAndBlockedFalseAndStatus(User.UserRole role, User.UserStatus status);

    List<User> findByRoleAndBlockedFalseAndCreatedAtAfter(User.UserRole role, OffsetDateTime since);

    /**
     * Users worth a re-engagement message: active but silent, or expired for a while
     */
    @Query("SELECT u FROM User u WHERE u.role = :role AND u.blocked = false AND (" +
            "(u.status = :activeStatus AND u.lastInteraction < :interactionCutoff) OR " +
            "(u.status = :expiredStatus AND u.updatedAt < :expiredCutoff))")
    List<User> findReengagementCandidates(@Param("role") User.UserRole role,
                                          @Param("activeStatus") User.UserStatus activeStatus,
                                          @Param("interactionCutoff") OffsetDateTime interactionCutoff,
                                          @Param("expiredStatus") User.UserStatus expiredStatus,
                                          @Param("expiredCutoff") OffsetDateTime expiredCutoff);
}
