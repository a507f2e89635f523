package com.memberguard.backend.repositories;

import com.memberguard.backend.models.Offer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface OfferRepository extends JpaRepository<Offer, Long> {

    List<Offer> findByActiveTrueAndValidTillAfterOrderByValidTillAsc(OffsetDateTime now);

    @Modifying
    @Query("UPDATE Offer o SET o.active = false WHERE o.active = true AND o.validTill < :now")
    int deactivateExpired(@Param("now") OffsetDateTime now);
}
