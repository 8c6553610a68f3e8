package com.aiops.anomaly.alert;

import com.aiops.anomaly.config.AlertSinkConfig;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Sends a short SMS or WhatsApp text for each alert through Twilio.
 */
@Component
@Order(5)
public class TwilioAlertSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(TwilioAlertSink.class);

    private final AlertSinkConfig.Twilio config;

    public TwilioAlertSink(AlertSinkConfig alertSinkConfig) {
        this.config = alertSinkConfig.getTwilio();
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio alert sink initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio alert sink is DISABLED.");
        }
    }

    @Override
    public void sendAlert(String message, Map<String, Object> details, String alertType) {
        Message sent = Message.creator(
                new PhoneNumber(resolveNumber(config.getToNumber())),
                new PhoneNumber(resolveNumber(config.getFromNumber())),
                buildBody(message, details, alertType)
        ).create();

        log.info("Twilio alert sent for service={}, sid={}", details.getOrDefault("service", "N/A"), sent.getSid());
    }

    String buildBody(String message, Map<String, Object> details, String alertType) {
        if ("high_anomaly_rate".equals(alertType)) {
            return String.format(
                    "[ANOMALY RATE ALERT] %s\n" +
                    "Anomalies in window: %s\n" +
                    "Window: %ss\n" +
                    "Last anomaly: %s",
                    message,
                    details.get("anomaly_count_in_window"),
                    details.get("time_window_seconds"),
                    details.get("last_anomaly_timestamp"));
        }
        return "[ANOMALY ALERT] " + message;
    }

    String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }

    @Override
    public String getName() {
        return "twilio-" + config.getChannel();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }
}
