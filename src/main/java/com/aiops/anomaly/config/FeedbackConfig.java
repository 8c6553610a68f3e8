package com.aiops.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection.feedback")
public class FeedbackConfig {
    private String storePath = "feedback/labeled_data.json";
}
