package com.memberguard.backend.services;

import com.memberguard.backend.models.AuditLog;
import com.memberguard.backend.repositories.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only writer for the audit trail
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLog record(long actorId, AuditLog.ActionType actionType, Long targetUserId, Map<String, Object> details) {
        AuditLog entry = AuditLog.builder()
                .actorId(actorId)
                .actionType(actionType)
                .targetUserId(targetUserId)
                .details(details != null ? new HashMap<>(details) : new HashMap<>())
                .timestamp(OffsetDateTime.now(clock))
                .build();

        AuditLog saved = auditLogRepository.save(entry);
        log.debug("Audit {} by {} on {}: {}", actionType, actorId, targetUserId, details);
        return saved;
    }

    public AuditLog recordSystem(AuditLog.ActionType actionType, Long targetUserId, Map<String, Object> details) {
        return record(AuditLog.SYSTEM_ACTOR, actionType, targetUserId, details);
    }

    public List<AuditLog> recentEntries() {
        return auditLogRepository.findTop15ByOrderByTimestampDesc();
    }
}
