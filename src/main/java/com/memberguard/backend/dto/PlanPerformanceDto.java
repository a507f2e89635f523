package com.memberguard.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanPerformanceDto {

    private String planName;
    private int durationDays;
    private long activeSubscriptions;
}
