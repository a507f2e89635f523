package com.memberguard.backend.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ApproveRequest {

    @NotNull(message = "Plan is required")
    private Long planId;
}
