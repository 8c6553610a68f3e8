package com.aiops.anomaly.alert;

import java.util.Map;

/**
 * Destination for aggregate alerts. Implementations may throw on delivery failure;
 * {@link AlertManager} isolates each sink from the others.
 */
public interface AlertSink {

    String ALERT_TYPE_DEFAULT = "standard_anomaly";

    /**
     * @param alertType routing hint, e.g. {@code high_anomaly_rate}; may be null
     */
    void sendAlert(String message, Map<String, Object> details, String alertType);

    String getName();

    default boolean isEnabled() {
        return true;
    }
}
