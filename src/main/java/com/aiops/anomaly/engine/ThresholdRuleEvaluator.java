package com.aiops.anomaly.engine;

import com.aiops.anomaly.config.DetectionConfig;
import com.aiops.anomaly.model.AnomalyRecord;
import com.aiops.anomaly.model.CanonicalLogRecord;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checks canonical records against per-feature upper thresholds.
 *
 * The effective rules for a service are the default thresholds with the service's own
 * thresholds laid over them: service values replace defaults key by key, default key
 * order is kept, and service-only keys follow. Rules are checked in that order and the
 * first strict exceedance wins.
 */
@Component
public class ThresholdRuleEvaluator {

    private final DetectionConfig detectionConfig;

    // Effective rule maps are derived from static config, so they are built once per service
    private final Map<String, Map<String, Double>> effectiveRuleCache = new ConcurrentHashMap<>();

    public ThresholdRuleEvaluator(DetectionConfig detectionConfig) {
        this.detectionConfig = detectionConfig;
    }

    public Map<String, Double> effectiveRules(String service) {
        String key = service != null ? service : "";
        return effectiveRuleCache.computeIfAbsent(key, this::mergeRules);
    }

    /**
     * @return a rule-violation anomaly for the first exceeded threshold, or empty
     */
    public Optional<AnomalyRecord> evaluate(CanonicalLogRecord record) {
        for (Map.Entry<String, Double> rule : effectiveRules(record.getService()).entrySet()) {
            Double actual = record.getFeatures().get(rule.getKey());
            if (actual != null && rule.getValue() != null && actual > rule.getValue()) {
                return Optional.of(violation(record, rule.getKey(), rule.getValue(), actual));
            }
        }
        return Optional.empty();
    }

    private Map<String, Double> mergeRules(String service) {
        DetectionConfig.AlertConditions conditions = detectionConfig.getAlertConditions();
        Map<String, Double> merged = new LinkedHashMap<>(conditions.getDefaults());
        Map<String, Double> overrides = conditions.getServices().get(service);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return Collections.unmodifiableMap(merged);
    }

    private AnomalyRecord violation(CanonicalLogRecord record, String feature, double threshold, double actual) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("violated_rule", feature);
        metadata.put("threshold", threshold);
        metadata.put("actual_value", actual);

        return AnomalyRecord.builder()
                .timestamp(record.getTimestamp())
                .service(record.getService())
                .source(record.getSource())
                .logLevel(record.getLogLevel())
                .message(String.format("Rule violation: %s (%s) > %s", feature, actual, threshold))
                .anomalyScore(detectionConfig.getRuleViolationScore())
                .ruleViolation(true)
                .features(new LinkedHashMap<>(record.getFeatures()))
                .rawLog(record.getRawLog())
                .metadata(metadata)
                .context(new LinkedHashMap<>())
                .build();
    }
}
