package com.aiops.anomaly.service;

import com.aiops.anomaly.alert.AlertManager;
import com.aiops.anomaly.config.DetectionConfig;
import com.aiops.anomaly.config.MetricsConfig;
import com.aiops.anomaly.model.AnomalyRecord;
import com.aiops.anomaly.model.RateAlertRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns bursts of anomalies into a single aggregate alert per service.
 *
 * Each service keeps a sliding window of anomaly timestamps. The window is measured back
 * from the newest anomaly's own timestamp, not the wall clock. When the window holds at
 * least the rule's count, one alert is sent and the window is emptied.
 */
@Service
public class RateAlertThrottle {

    private static final Logger log = LoggerFactory.getLogger(RateAlertThrottle.class);

    public static final String ALERT_TYPE = "high_anomaly_rate";

    private final DetectionConfig.RateAlerts rules;
    private final AlertManager alertManager;
    private final MetricsConfig metricsConfig;

    private final Map<String, Deque<Instant>> windows = new ConcurrentHashMap<>();

    public RateAlertThrottle(DetectionConfig detectionConfig, AlertManager alertManager,
                             MetricsConfig metricsConfig) {
        this.rules = detectionConfig.getRateAlerts();
        this.alertManager = alertManager;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Feed new anomalies into their services' windows.
     *
     * @return services for which an aggregate alert was sent
     */
    public Set<String> recordAnomalies(List<AnomalyRecord> anomalies) {
        Set<String> fired = new LinkedHashSet<>();
        for (AnomalyRecord anomaly : anomalies) {
            if (anomaly.getService() == null || anomaly.getTimestamp() == null) {
                continue;
            }
            RateAlertRule rule = ruleFor(anomaly.getService());
            if (rule == null) {
                continue;
            }

            Map<String, Object> alert = record(anomaly, rule);
            if (alert != null) {
                alertManager.sendAlert("High Anomaly Rate Detected for service: " + anomaly.getService(),
                        alert, ALERT_TYPE);
                metricsConfig.recordRateAlert(anomaly.getService());
                fired.add(anomaly.getService());
                log.warn("High anomaly rate alert triggered for service '{}'. Count: {} in {}s.",
                        anomaly.getService(), alert.get("anomaly_count_in_window"), rule.getWindowSeconds());
            }
        }
        return fired;
    }

    public int getWindowSize(String service) {
        Deque<Instant> window = windows.get(service);
        if (window == null) {
            return 0;
        }
        synchronized (window) {
            return window.size();
        }
    }

    public void reset() {
        windows.clear();
    }

    RateAlertRule ruleFor(String service) {
        RateAlertRule rule = rules.getServices().get(service);
        return rule != null ? rule : rules.getDefaults();
    }

    // Returns the alert details if this anomaly tipped the window over, null otherwise
    private Map<String, Object> record(AnomalyRecord anomaly, RateAlertRule rule) {
        Deque<Instant> window = windows.computeIfAbsent(anomaly.getService(), s -> new ArrayDeque<>());
        Instant now = anomaly.getTimestamp();
        Instant windowStart = now.minusSeconds(rule.getWindowSeconds());

        synchronized (window) {
            window.addLast(now);
            window.removeIf(ts -> ts.isBefore(windowStart));

            log.debug("Service '{}' anomaly count: {} within window. Rule requires: {}.",
                    anomaly.getService(), window.size(), rule.getCount());

            if (window.size() < rule.getCount()) {
                return null;
            }

            Map<String, Object> ruleDetails = new LinkedHashMap<>();
            ruleDetails.put("count", rule.getCount());
            ruleDetails.put("window_seconds", rule.getWindowSeconds());

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("service", anomaly.getService());
            details.put("rule_violated", ruleDetails);
            details.put("anomaly_count_in_window", window.size());
            details.put("time_window_seconds", rule.getWindowSeconds());
            details.put("last_anomaly_timestamp", now.toString());

            window.clear();
            return details;
        }
    }
}
