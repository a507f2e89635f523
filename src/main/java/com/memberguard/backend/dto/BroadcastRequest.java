package com.memberguard.backend.dto;

import com.memberguard.backend.services.BroadcastService;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class BroadcastRequest {

    @NotNull(message = "Target audience is required")
    private BroadcastService.BroadcastTarget target;

    @NotBlank(message = "Message is required")
    @Size(max = 4096, message = "Message exceeds the Telegram limit of 4096 characters")
    private String message;
}
