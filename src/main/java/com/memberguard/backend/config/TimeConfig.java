package com.memberguard.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single source of time for the lifecycle jobs.
 * Always inject the Clock instead of calling OffsetDateTime.now() / LocalDate.now().
 * The clock carries the lifecycle zone so "today" means the same calendar day everywhere.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock appClock(LifecycleProperties lifecycleProperties) {
        return Clock.system(ZoneId.of(lifecycleProperties.getZone()));
    }
}
