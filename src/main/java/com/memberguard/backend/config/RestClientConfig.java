package com.memberguard.backend.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    @Bean
    public RestTemplate telegramRestTemplate(RestTemplateBuilder builder, TelegramProperties telegramProperties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(telegramProperties.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(telegramProperties.getReadTimeoutMs()))
                .build();
    }
}
