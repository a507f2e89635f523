package com.memberguard.backend.repositories;

import com.memberguard.backend.models.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    long countByActionTypeAndTimestampBetween(AuditLog.ActionType actionType, OffsetDateTime start, OffsetDateTime end);

    List<AuditLog> findTop15ByOrderByTimestampDesc();

    List<AuditLog> findByTargetUserIdOrderByTimestampDesc(Long targetUserId);
}
