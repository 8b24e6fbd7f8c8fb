package com.anxietycompanion.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Value("${app.anthropic.base-url:https://api.anthropic.com}")
    private String anthropicBaseUrl;

    @Value("${app.anthropic.version:2023-06-01}")
    private String anthropicVersion;

    @Bean
    public WebClient anthropicClient() {
        return WebClient.builder()
                .baseUrl(anthropicBaseUrl)
                .defaultHeader("anthropic-version", anthropicVersion)
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(1024 * 1024)) // 1MB
                .build();
    }
}
