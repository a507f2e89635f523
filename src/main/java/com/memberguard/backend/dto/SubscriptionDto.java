package com.memberguard.backend.dto;

import com.memberguard.backend.models.Subscription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionDto {

    private Long id;
    private Long telegramId;
    private String userName;
    private String planName;
    private int durationDays;
    private OffsetDateTime startDate;
    private OffsetDateTime expiryDate;
    private String status;
    private int graceDaysUsed;
    private boolean renewal;
    private Long approvedBy;

    public static SubscriptionDto from(Subscription subscription) {
        return SubscriptionDto.builder()
                .id(subscription.getId())
                .telegramId(subscription.getTelegramId())
                .userName(subscription.getUser() != null ? subscription.getUser().getName() : null)
                .planName(subscription.getPlanName())
                .durationDays(subscription.getDurationDays())
                .startDate(subscription.getStartDate())
                .expiryDate(subscription.getExpiryDate())
                .status(subscription.getStatus().name())
                .graceDaysUsed(subscription.getGraceDaysUsed())
                .renewal(subscription.isRenewal())
                .approvedBy(subscription.getApprovedBy())
                .build();
    }
}
