package com.aiops.anomaly.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Format-agnostic view of one log line. Features hold numeric values only.
 */
@Value
@Builder
public class CanonicalLogRecord {

    String rawLog;
    String service;
    String source;
    Instant timestamp;

    @Builder.Default
    String logLevel = "unknown";

    @Builder.Default
    String message = "";

    @Singular
    Map<String, Double> features;
}
