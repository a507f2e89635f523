package com.memberguard.backend.dto;

import com.memberguard.backend.models.AccessRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessRequestDto {

    private Long id;
    private Long telegramId;
    private String name;
    private String username;
    private String status;
    private OffsetDateTime requestDate;
    private OffsetDateTime actionDate;
    private Long actionBy;
    private Long selectedPlanId;
    private boolean renewal;

    public static AccessRequestDto from(AccessRequest request) {
        return AccessRequestDto.builder()
                .id(request.getId())
                .telegramId(request.getUser().getTelegramId())
                .name(request.getUser().getName())
                .username(request.getUser().getUsername())
                .status(request.getStatus().name())
                .requestDate(request.getRequestDate())
                .actionDate(request.getActionDate())
                .actionBy(request.getActionBy())
                .selectedPlanId(request.getSelectedPlanId())
                .renewal(request.isRenewal())
                .build();
    }
}
