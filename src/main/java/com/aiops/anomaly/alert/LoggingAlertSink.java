package com.aiops.anomaly.alert;

import com.aiops.anomaly.config.AlertSinkConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@Order(1)
public class LoggingAlertSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertSink.class);

    private final AlertSinkConfig config;
    private final ObjectMapper objectMapper;

    public LoggingAlertSink(AlertSinkConfig config) {
        this.config = config;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void sendAlert(String message, Map<String, Object> details, String alertType) {
        log.warn("ALERT [{}] {} - {}", alertType != null ? alertType : "general", message, toJson(details));
    }

    @Override
    public String getName() {
        return "logging";
    }

    @Override
    public boolean isEnabled() {
        return config.getLogging().isEnabled();
    }

    private String toJson(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize alert details: {}", e.getOriginalMessage());
            return String.valueOf(details);
        }
    }
}
