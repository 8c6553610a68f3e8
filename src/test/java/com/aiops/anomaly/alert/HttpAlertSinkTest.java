package com.aiops.anomaly.alert;

import com.aiops.anomaly.config.AlertSinkConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HttpAlertSinkTest {

    @Mock private RestTemplate restTemplate;

    private AlertSinkConfig config;
    private Map<String, Object> rateDetails;

    @BeforeEach
    void setUp() {
        config = new AlertSinkConfig();
        rateDetails = new LinkedHashMap<>();
        rateDetails.put("service", "database");
        rateDetails.put("anomaly_count_in_window", 5);
        rateDetails.put("time_window_seconds", 120L);
    }

    @Test
    @SuppressWarnings("unchecked")
    void webhook_postsTypeMessageAndDetails() {
        config.getWebhook().setEnabled(true);
        config.getWebhook().setUrl("http://hooks.local/alerts");
        WebhookAlertSink sink = new WebhookAlertSink(config, restTemplate);

        sink.sendAlert("High Anomaly Rate Detected for service: database", rateDetails, "high_anomaly_rate");

        ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
        verify(restTemplate).postForEntity(eq("http://hooks.local/alerts"), body.capture(), eq(String.class));
        Map<String, Object> payload = (Map<String, Object>) body.getValue();
        assertThat(payload)
                .containsEntry("alert_type", "high_anomaly_rate")
                .containsEntry("message", "High Anomaly Rate Detected for service: database")
                .containsEntry("details", rateDetails);
    }

    @Test
    @SuppressWarnings("unchecked")
    void webhook_missingAlertTypeUsesDefault() {
        config.getWebhook().setEnabled(true);
        config.getWebhook().setUrl("http://hooks.local/alerts");
        WebhookAlertSink sink = new WebhookAlertSink(config, restTemplate);

        sink.sendAlert("msg", rateDetails, null);

        ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
        verify(restTemplate).postForEntity(anyString(), body.capture(), eq(String.class));
        assertThat((Map<String, Object>) body.getValue()).containsEntry("alert_type", "standard_anomaly");
    }

    @Test
    void webhook_transportErrorPropagatesToManager() {
        config.getWebhook().setUrl("http://hooks.local/alerts");
        when(restTemplate.postForEntity(anyString(), any(), eq(String.class)))
                .thenThrow(new ResourceAccessException("timeout"));
        WebhookAlertSink sink = new WebhookAlertSink(config, restTemplate);

        assertThatThrownBy(() -> sink.sendAlert("msg", rateDetails, null))
                .isInstanceOf(ResourceAccessException.class);
    }

    @Test
    void sinks_disabledUnlessConfigured() {
        assertThat(new WebhookAlertSink(config, restTemplate).isEnabled()).isFalse();
        assertThat(new SlackAlertSink(config, restTemplate).isEnabled()).isFalse();
        assertThat(new PagerDutyAlertSink(config, restTemplate).isEnabled()).isFalse();

        config.getSlack().setEnabled(true);
        assertThat(new SlackAlertSink(config, restTemplate).isEnabled()).isFalse();
        config.getSlack().setWebhookUrl("https://hooks.slack.test/x");
        assertThat(new SlackAlertSink(config, restTemplate).isEnabled()).isTrue();
    }

    @Test
    @SuppressWarnings("unchecked")
    void slack_rateAlertUsesHighRateHeaderAndWindowFields() {
        SlackAlertSink sink = new SlackAlertSink(config, restTemplate);

        Map<String, Object> payload = sink.buildPayload("High rate", rateDetails, "high_anomaly_rate");

        Map<String, Object> attachment = ((List<Map<String, Object>>) payload.get("attachments")).get(0);
        List<Map<String, Object>> blocks = (List<Map<String, Object>>) attachment.get("blocks");
        Map<String, Object> headerText = (Map<String, Object>) blocks.get(0).get("text");
        assertThat(headerText.get("text")).isEqualTo(SlackAlertSink.HIGH_RATE_HEADER);
        assertThat(attachment.get("color")).isEqualTo("#FF0000");

        List<Map<String, Object>> fields = (List<Map<String, Object>>) blocks.get(3).get("fields");
        assertThat(fields).extracting(f -> f.get("text"))
                .containsExactly("*Time Window*\n120s", "*Anomaly Count*\n5");
    }

    @Test
    @SuppressWarnings("unchecked")
    void pagerDuty_buildsTriggerEvent() {
        config.getPagerduty().setRoutingKey("routing-123");
        PagerDutyAlertSink sink = new PagerDutyAlertSink(config, restTemplate);

        Map<String, Object> event = sink.buildEvent("High rate", rateDetails);

        assertThat(event)
                .containsEntry("routing_key", "routing-123")
                .containsEntry("event_action", "trigger");
        Map<String, Object> payload = (Map<String, Object>) event.get("payload");
        assertThat(payload)
                .containsEntry("summary", "High rate")
                .containsEntry("source", "database")
                .containsEntry("severity", "critical")
                .containsEntry("custom_details", rateDetails);
    }

    @Test
    void pagerDuty_postsToConfiguredUrl() {
        config.getPagerduty().setRoutingKey("routing-123");
        PagerDutyAlertSink sink = new PagerDutyAlertSink(config, restTemplate);

        sink.sendAlert("High rate", rateDetails, "high_anomaly_rate");

        verify(restTemplate).postForEntity(eq("https://events.pagerduty.com/v2/enqueue"), anyMap(), eq(String.class));
    }
}
