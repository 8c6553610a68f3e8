package com.aiops.anomaly.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate alertRestTemplate(RestTemplateBuilder builder, AlertSinkConfig alertSinkConfig) {
        Duration timeout = Duration.ofSeconds(alertSinkConfig.getTimeoutSeconds());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
