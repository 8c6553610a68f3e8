package com.aiops.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Per-line detection outcome")
public record StreamResult(
        @Schema(description = "Anomaly score; 0.0 for lines that were not flagged", example = "-0.0832")
        double score,
        @Schema(description = "1 if the line was flagged, 0 otherwise", example = "1")
        int isAnomaly) {
}
