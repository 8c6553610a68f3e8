package com.aiops.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Schema(description = "A log line flagged as anomalous, either by a threshold rule or by the outlier model")
public class AnomalyRecord {

    @Schema(description = "Timestamp of the log line (UTC)", example = "2024-01-01T10:00:00Z")
    Instant timestamp;

    @Schema(description = "Service name", example = "web_server")
    String service;

    @Schema(description = "Log source", example = "nginx")
    String source;

    @Schema(description = "Log level", example = "ERROR")
    String logLevel;

    @Schema(description = "Log message, or a description of the violated rule",
            example = "Rule violation: response_time (5000.0) > 2000.0")
    String message;

    @Schema(description = "Anomaly score. Lower is more anomalous on the model path; rule violations carry a fixed score.",
            example = "-0.0832")
    double anomalyScore;

    @Schema(description = "True when a threshold rule flagged the line, false when the outlier model did", example = "true")
    boolean ruleViolation;

    @Schema(description = "Features used for the decision")
    Map<String, Double> features;

    @Schema(description = "Original raw log line")
    String rawLog;

    @Schema(description = "Additional metadata, e.g. violated_rule, threshold and actual_value for rule violations")
    Map<String, Object> metadata;

    @Schema(description = "Detection context")
    Map<String, Object> context;

    @Builder
    @Jacksonized
    public AnomalyRecord(Instant timestamp, String service, String source, String logLevel, String message,
                         double anomalyScore, boolean ruleViolation, Map<String, Double> features,
                         String rawLog, Map<String, Object> metadata, Map<String, Object> context) {
        this.timestamp = timestamp;
        this.service = service;
        this.source = source;
        this.logLevel = logLevel;
        this.message = message;
        this.anomalyScore = anomalyScore;
        this.ruleViolation = ruleViolation;
        this.features = readOnlyCopy(features);
        this.rawLog = rawLog;
        this.metadata = readOnlyCopy(metadata);
        this.context = readOnlyCopy(context);
    }

    // Copied and read-only: a record never changes after it is built
    private static <V> Map<String, V> readOnlyCopy(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
