package com.memberguard.backend.repositories;

import com.memberguard.backend.models.AccessRequest;
import com.memberguard.backend.models.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface AccessRequestRepository extends JpaRepository<AccessRequest, Long> {

    Optional<AccessRequest> findFirstByUserAndStatus(User user, AccessRequest.RequestStatus status);

    List<AccessRequest> findByStatusOrderByRequestDateAsc(AccessRequest.RequestStatus status);

    long countByStatus(AccessRequest.RequestStatus status);

    long countByRequestDateBetween(OffsetDateTime start, OffsetDateTime end);

    long countByStatusAndActionDateBetween(AccessRequest.RequestStatus status, OffsetDateTime start, OffsetDateTime end);

    long countByStatusAndRenewalTrueAndActionDateBetween(AccessRequest.RequestStatus status,
                                                         OffsetDateTime start,
                                                         OffsetDateTime end);
}
