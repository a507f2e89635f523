package com.memberguard.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * First or repeated contact from a chat user, as relayed by the bot front end
 */
@Data
public class ContactRequest {

    @NotNull(message = "Telegram id is required")
    @Positive
    private Long telegramId;

    @NotBlank(message = "Name is required")
    private String name;

    private String username;

    @Size(max = 8, message = "Referral codes are 8 characters")
    private String referralCode;
}
