package com.aiops.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "High-level service and model counters")
public class MetricsResponse {

    @Schema(description = "Rows scored by the outlier model since startup", example = "1200")
    private long predictionCount;

    @Schema(description = "Anomalies currently held in the history", example = "37")
    private int anomalyCount;

    @Schema(description = "When the model was last refitted; null if never since startup")
    private Instant lastTrained;

    @Schema(description = "Feedback records received since startup", example = "5")
    private long feedbackReceived;

    @Schema(description = "Mean anomaly score of the stored history", example = "0.41")
    private double avgScore;
}
