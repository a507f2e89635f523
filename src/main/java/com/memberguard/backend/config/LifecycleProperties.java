package com.memberguard.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables of the subscription lifecycle jobs.
 * Every value has a default so the service starts with an empty app.lifecycle block.
 */
@ConfigurationProperties(prefix = "app.lifecycle")
@Validated
@Data
public class LifecycleProperties {

    /**
     * Days between expiry and removal from the group
     */
    @Min(1)
    private int gracePeriodDays = 3;

    /**
     * Days added to a referrer's subscription when a referral converts
     */
    @Min(0)
    private int referralBonusDays = 3;

    /**
     * Lifetime of a single-use group invite
     */
    @Min(60)
    private int inviteTtlSeconds = 600;

    /**
     * Minimum pause between two broadcast sends (platform rate limit)
     */
    @Min(0)
    private long broadcastDelayMs = 50;

    @Min(1)
    private int inactiveAfterDays = 30;

    @Min(1)
    private int expiredReengageAfterDays = 7;

    /**
     * Window used by the NEW broadcast target
     */
    @Min(1)
    private int newUserWindowDays = 3;

    /**
     * Zone in which calendar days (reminder windows, grace counting) are evaluated
     */
    @NotBlank
    private String zone = "UTC";
}
