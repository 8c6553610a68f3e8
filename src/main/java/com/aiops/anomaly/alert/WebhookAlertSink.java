package com.aiops.anomaly.alert;

import com.aiops.anomaly.config.AlertSinkConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts {@code {alert_type, message, details}} to a generic HTTP endpoint.
 */
@Component
@Order(2)
public class WebhookAlertSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(WebhookAlertSink.class);

    private final AlertSinkConfig.Webhook config;
    private final RestTemplate restTemplate;

    public WebhookAlertSink(AlertSinkConfig alertSinkConfig,
                            @Qualifier("alertRestTemplate") RestTemplate restTemplate) {
        this.config = alertSinkConfig.getWebhook();
        this.restTemplate = restTemplate;
    }

    @Override
    public void sendAlert(String message, Map<String, Object> details, String alertType) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alert_type", alertType != null ? alertType : ALERT_TYPE_DEFAULT);
        payload.put("message", message);
        payload.put("details", details);

        restTemplate.postForEntity(config.getUrl(), payload, String.class);
        log.info("Webhook alert delivered to {}", config.getUrl());
    }

    @Override
    public String getName() {
        return "webhook";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && config.getUrl() != null && !config.getUrl().isBlank();
    }
}
