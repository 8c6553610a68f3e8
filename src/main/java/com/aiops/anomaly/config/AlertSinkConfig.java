package com.aiops.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "alerts")
public class AlertSinkConfig {

    private Logging logging = new Logging();
    private Webhook webhook = new Webhook();
    private Slack slack = new Slack();
    private PagerDuty pagerduty = new PagerDuty();
    private Twilio twilio = new Twilio();

    // Applies to every HTTP-based sink
    private int timeoutSeconds = 5;

    @Data
    public static class Logging {
        private boolean enabled = true;
    }

    @Data
    public static class Webhook {
        private boolean enabled = false;
        private String url;
    }

    @Data
    public static class Slack {
        private boolean enabled = false;
        private String webhookUrl;
    }

    @Data
    public static class PagerDuty {
        private boolean enabled = false;
        private String routingKey;
        private String apiUrl = "https://events.pagerduty.com/v2/enqueue";
    }

    @Data
    public static class Twilio {
        private boolean enabled = false;
        private String accountSid;
        private String authToken;
        private String fromNumber;
        private String toNumber;
        private String channel = "sms";  // "sms" or "whatsapp"
    }
}
