package com.memberguard.backend.dto;

import com.memberguard.backend.models.AuditLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogDto {

    private Long id;
    private Long actorId;
    private String actionType;
    private Long targetUserId;
    private Map<String, Object> details;
    private OffsetDateTime timestamp;

    public static AuditLogDto from(AuditLog entry) {
        return AuditLogDto.builder()
                .id(entry.getId())
                .actorId(entry.getActorId())
                .actionType(entry.getActionType().name())
                .targetUserId(entry.getTargetUserId())
                .details(entry.getDetails())
                .timestamp(entry.getTimestamp())
                .build();
    }
}
