package com.memberguard.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.telegram")
@Data
public class TelegramProperties {

    private String apiBaseUrl = "https://api.telegram.org";

    private String botToken;

    /**
     * Chat id of the managed premium group
     */
    private String premiumGroupId;

    /**
     * Chat id of the operators' log channel
     */
    private String logChannelId;

    private int connectTimeoutMs = 5000;

    private int readTimeoutMs = 10000;
}
