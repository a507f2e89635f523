package com.memberguard.backend.repositories;

import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.models.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Candidate queries for the lifecycle jobs plus reporting aggregates
 */
@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    /**
     * The user's live (ACTIVE or GRACE) subscription, if any
     */
    Optional<Subscription> findFirstByUserAndStatusIn(User user, Collection<Subscription.SubscriptionStatus> statuses);

    boolean existsByUserAndStatusIn(User user, Collection<Subscription.SubscriptionStatus> statuses);

    long countByUser(User user);

    Optional<Subscription> findFirstByUserAndStatusAndExpiryDateAfter(User user,
                                                                      Subscription.SubscriptionStatus status,
                                                                      OffsetDateTime now);

    /**
     * Reminder window: expiry inside [start, end]
     */
    List<Subscription> findByStatusAndExpiryDateBetween(Subscription.SubscriptionStatus status,
                                                        OffsetDateTime start,
                                                        OffsetDateTime end);

    List<Subscription> findByStatusAndExpiryDateBefore(Subscription.SubscriptionStatus status, OffsetDateTime cutoff);

    List<Subscription> findByStatusAndExpiryDateAfter(Subscription.SubscriptionStatus status, OffsetDateTime now);

    List<Subscription> findByStatus(Subscription.SubscriptionStatus status);

    List<Subscription> findByStatusIn(Collection<Subscription.SubscriptionStatus> statuses);

    long countByStatus(Subscription.SubscriptionStatus status);

    long countByStatusAndExpiryDateAfter(Subscription.SubscriptionStatus status, OffsetDateTime now);

    long countByStatusAndUpdatedAtBetween(Subscription.SubscriptionStatus status, OffsetDateTime start, OffsetDateTime end);

    /**
     * Sales per plan issued in a period: [planName, count, revenue]
     */
    @Query("SELECT s.planName, COUNT(s), COALESCE(SUM(p.price), 0) FROM Subscription s, Plan p " +
            "WHERE p.id = s.planId AND s.createdAt BETWEEN :start AND :end AND s.status IN :statuses " +
            "GROUP BY s.planName ORDER BY s.planName")
    List<Object[]> salesByPlan(@Param("start") OffsetDateTime start,
                               @Param("end") OffsetDateTime end,
                               @Param("statuses") Collection<Subscription.SubscriptionStatus> statuses);

    /**
     * Active subscriptions per plan: [planName, durationDays, count]
     */
    @Query("SELECT s.planName, s.durationDays, COUNT(s) FROM Subscription s " +
            "WHERE s.status = :status AND s.expiryDate > :now " +
            "GROUP BY s.planName, s.durationDays ORDER BY s.durationDays")
    List<Object[]> countLiveByPlan(@Param("status") Subscription.SubscriptionStatus status,
                                   @Param("now") OffsetDateTime now);
}
