package com.aiops.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Aggregate statistics over the anomaly history")
public record AnomalyStats(
        @Schema(description = "Number of stored anomalies", example = "42")
        int total,
        @Schema(description = "Mean anomaly score", example = "0.41")
        double avgScore) {
}
