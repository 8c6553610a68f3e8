package com.aiops.anomaly.service;

import com.aiops.anomaly.config.MetricsConfig;
import com.aiops.anomaly.engine.DetectionEngine;
import com.aiops.anomaly.model.AnomalyRecord;
import com.aiops.anomaly.model.AnomalyStats;
import com.aiops.anomaly.model.CanonicalLogRecord;
import com.aiops.anomaly.model.ServiceStats;
import com.aiops.anomaly.repository.AnomalyHistoryRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Main orchestrator for anomaly detection.
 *
 * Flow:
 * 1. Run the detection engine over the parsed batch (rules first, then the outlier model)
 * 2. Append the anomalies to the persisted history
 * 3. Feed them into the per-service rate throttle, which may send an aggregate alert
 *
 * Individual anomalies are stored but never sent to alert sinks on their own.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final DetectionEngine detectionEngine;
    private final AnomalyHistoryRepository historyRepository;
    private final RateAlertThrottle rateAlertThrottle;
    private final ModelService modelService;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(DetectionEngine detectionEngine,
                                   AnomalyHistoryRepository historyRepository,
                                   RateAlertThrottle rateAlertThrottle,
                                   ModelService modelService,
                                   MetricsConfig metricsConfig) {
        this.detectionEngine = detectionEngine;
        this.historyRepository = historyRepository;
        this.rateAlertThrottle = rateAlertThrottle;
        this.modelService = modelService;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Detect anomalies in a parsed batch, store them and update the rate windows.
     *
     * @return the anomalies found, at most one per distinct raw log line
     */
    @Observed(name = "anomaly.detect", contextualName = "detect-anomalies")
    public List<AnomalyRecord> detectAndStore(List<CanonicalLogRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }
        metricsConfig.recordBatch(records.size());

        List<AnomalyRecord> anomalies = detectionEngine.detect(records);
        if (anomalies.isEmpty()) {
            log.debug("No anomalies in batch of {} records", records.size());
            return anomalies;
        }

        historyRepository.appendAll(anomalies);
        for (AnomalyRecord anomaly : anomalies) {
            metricsConfig.recordAnomaly(anomaly.isRuleViolation());
        }
        rateAlertThrottle.recordAnomalies(anomalies);

        log.info("Detected and stored {} new anomalies out of {} records", anomalies.size(), records.size());
        return anomalies;
    }

    public List<AnomalyRecord> getRecentAnomalies(int limit) {
        return historyRepository.findMostAnomalous(limit);
    }

    public AnomalyStats getStats() {
        return historyRepository.getStats();
    }

    public Optional<ServiceStats> getServiceStats(String service) {
        return historyRepository.getServiceStats(service);
    }

    public void clearAnomalies() {
        historyRepository.clear();
    }

    public boolean isHealthy() {
        return modelService.isHealthy();
    }
}
