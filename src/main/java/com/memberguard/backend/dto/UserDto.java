package com.memberguard.backend.dto;

import com.memberguard.backend.models.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserDto {

    private Long telegramId;
    private String name;
    private String username;
    private String status;
    private boolean blocked;
    private String referralCode;
    private boolean referred;
    private Integer graceDaysRemaining;
    private OffsetDateTime lastInteraction;
    private OffsetDateTime createdAt;

    public static UserDto from(User user) {
        return UserDto.builder()
                .telegramId(user.getTelegramId())
                .name(user.getName())
                .username(user.getUsername())
                .status(user.getStatus().name())
                .blocked(user.isBlocked())
                .referralCode(user.getReferralCode())
                .referred(user.hasReferrer())
                .graceDaysRemaining(user.getGraceDaysRemaining())
                .lastInteraction(user.getLastInteraction())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
