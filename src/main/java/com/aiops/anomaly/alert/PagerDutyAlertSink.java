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
 * Triggers a critical PagerDuty incident through the Events API v2.
 */
@Component
@Order(4)
public class PagerDutyAlertSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(PagerDutyAlertSink.class);

    static final String DEFAULT_SOURCE = "log-anomaly-detection";

    private final AlertSinkConfig.PagerDuty config;
    private final RestTemplate restTemplate;

    public PagerDutyAlertSink(AlertSinkConfig alertSinkConfig,
                              @Qualifier("alertRestTemplate") RestTemplate restTemplate) {
        this.config = alertSinkConfig.getPagerduty();
        this.restTemplate = restTemplate;
    }

    @Override
    public void sendAlert(String message, Map<String, Object> details, String alertType) {
        restTemplate.postForEntity(config.getApiUrl(), buildEvent(message, details), String.class);
        log.info("PagerDuty event triggered: {}", message);
    }

    Map<String, Object> buildEvent(String message, Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("summary", message);
        payload.put("source", details.getOrDefault("service", DEFAULT_SOURCE));
        payload.put("severity", "critical");
        payload.put("custom_details", details);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("routing_key", config.getRoutingKey());
        event.put("event_action", "trigger");
        event.put("payload", payload);
        return event;
    }

    @Override
    public String getName() {
        return "pagerduty";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && config.getRoutingKey() != null && !config.getRoutingKey().isBlank();
    }
}
