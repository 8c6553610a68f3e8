package com.aiops.anomaly.alert;

import com.aiops.anomaly.config.AlertSinkConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Posts a Block Kit attachment to a Slack incoming webhook.
 */
@Component
@Order(3)
public class SlackAlertSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(SlackAlertSink.class);

    static final String HIGH_RATE_HEADER = "High Anomaly Rate Detected";
    static final String DEFAULT_HEADER = "Anomaly Detected";

    private final AlertSinkConfig.Slack config;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public SlackAlertSink(AlertSinkConfig alertSinkConfig,
                          @Qualifier("alertRestTemplate") RestTemplate restTemplate) {
        this.config = alertSinkConfig.getSlack();
        this.restTemplate = restTemplate;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void sendAlert(String message, Map<String, Object> details, String alertType) {
        restTemplate.postForEntity(config.getWebhookUrl(), buildPayload(message, details, alertType), String.class);
        log.info("Slack alert delivered for service={}", details.getOrDefault("service", "N/A"));
    }

    Map<String, Object> buildPayload(String message, Map<String, Object> details, String alertType) {
        String service = String.valueOf(details.getOrDefault("service", "N/A"));

        String header;
        String title;
        List<Map<String, Object>> fields;
        if ("high_anomaly_rate".equals(alertType)) {
            header = HIGH_RATE_HEADER;
            title = "Service: *" + service + "*";
            fields = List.of(
                    field("Time Window", details.get("time_window_seconds") + "s"),
                    field("Anomaly Count", String.valueOf(details.get("anomaly_count_in_window"))));
        } else {
            header = DEFAULT_HEADER;
            title = "Service: *" + service + "* | Source: *" + details.getOrDefault("source", "N/A") + "*";
            fields = List.of(
                    field("Score", String.valueOf(details.getOrDefault("anomaly_score", 0))),
                    field("Timestamp", String.valueOf(details.getOrDefault("timestamp", "N/A"))));
        }

        List<Map<String, Object>> blocks = List.of(
                Map.of("type", "header", "text", Map.of("type", "plain_text", "text", header)),
                Map.of("type", "divider"),
                Map.of("type", "section", "text", Map.of("type", "mrkdwn", "text", title)),
                Map.of("type", "section", "fields", fields),
                Map.of("type", "section", "text", Map.of("type", "mrkdwn",
                        "text", "*Message*: " + message + "\n*Details*:\n```" + toJson(details) + "```")));

        return Map.of("attachments", List.of(Map.of("color", "#FF0000", "blocks", blocks)));
    }

    @Override
    public String getName() {
        return "slack";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && config.getWebhookUrl() != null && !config.getWebhookUrl().isBlank();
    }

    private static Map<String, Object> field(String title, String value) {
        return Map.of("type", "mrkdwn", "text", "*" + title + "*\n" + value);
    }

    private String toJson(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize alert details for Slack: {}", e.getOriginalMessage());
            return String.valueOf(details);
        }
    }
}
