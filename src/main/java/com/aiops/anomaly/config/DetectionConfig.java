package com.aiops.anomaly.config;

import com.aiops.anomaly.model.RateAlertRule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Model-path anomalies must score strictly below this cutoff (lower = more anomalous).
    private double anomalyThreshold = 0.75;

    // Fixed score stamped on every rule violation.
    private double ruleViolationScore = 1.0;

    // Feature thresholds: defaults apply to every service, services override per key.
    private AlertConditions alertConditions = new AlertConditions();

    // Rate-based (aggregate) alert policies.
    private RateAlerts rateAlerts = new RateAlerts();

    private History history = new History();

    @Data
    public static class AlertConditions {
        private Map<String, Double> defaults = new LinkedHashMap<>();
        private Map<String, Map<String, Double>> services = new LinkedHashMap<>();
    }

    @Data
    public static class RateAlerts {
        // Null means services without their own rule are never throttled.
        private RateAlertRule defaults;
        private Map<String, RateAlertRule> services = new LinkedHashMap<>();
    }

    @Data
    public static class History {
        private int capacity = 500;
        private String storagePath = "feedback/anomalies.json";
    }
}
