package com.aiops.anomaly.alert;

import com.aiops.anomaly.config.MetricsConfig;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans an alert out to every enabled sink, in registration order.
 * A failing sink is logged and counted but never stops delivery to the rest.
 */
@Service
public class AlertManager {

    private static final Logger log = LoggerFactory.getLogger(AlertManager.class);

    private final List<AlertSink> sinks = new CopyOnWriteArrayList<>();
    private final MetricsConfig metricsConfig;

    public AlertManager(List<AlertSink> sinks, MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
        for (AlertSink sink : sinks) {
            register(sink);
        }
    }

    public void register(AlertSink sink) {
        sinks.add(sink);
        log.info("Registered alert sink: {} (enabled={})", sink.getName(), sink.isEnabled());
    }

    public List<AlertSink> getSinks() {
        return List.copyOf(sinks);
    }

    @Async
    @Observed(name = "alert.dispatch", contextualName = "dispatch-alert")
    public void sendAlert(String message, Map<String, Object> details, String alertType) {
        if (sinks.isEmpty()) {
            log.warn("No alert sinks registered, dropping alert: {}", message);
            return;
        }

        for (AlertSink sink : sinks) {
            if (!sink.isEnabled()) {
                continue;
            }
            try {
                sink.sendAlert(message, details, alertType);
                metricsConfig.recordSinkDelivery(sink.getName(), "success");
            } catch (Exception e) {
                metricsConfig.recordSinkDelivery(sink.getName(), "error");
                log.error("Alert sink {} failed for alert '{}': {}", sink.getName(), message, e.getMessage(), e);
            }
        }
    }
}
