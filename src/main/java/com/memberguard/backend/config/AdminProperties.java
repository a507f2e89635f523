package com.memberguard.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Operator credentials for the admin REST surface. {@code telegramId} is recorded as the
 * actor of admin actions when a request does not name one.
 */
@ConfigurationProperties(prefix = "app.admin")
public record AdminProperties(String username, String password, Long telegramId) {

    public AdminProperties {
        if (username == null || username.isBlank()) {
            username = "admin";
        }
    }

    public long actorId(Long requested) {
        if (requested != null) {
            return requested;
        }
        return telegramId != null ? telegramId : 0L;
    }
}
