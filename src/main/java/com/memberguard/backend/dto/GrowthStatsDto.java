package com.memberguard.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrowthStatsDto {

    private long totalUsers;
    private long activeUsers;
    private long expiredUsers;
    private long pendingUsers;
    private long blockedUsers;
    private long newToday;

    // Subscriptions
    private long activeSubscriptions;
    private long graceSubscriptions;
    private long pendingRequests;
}
