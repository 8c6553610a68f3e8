package com.aiops.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "State and counters of the outlier model")
public class ModelInfo {

    @Schema(description = "Rows scored since startup", example = "1200")
    private long predictionCount;

    @Schema(description = "Rows labelled as outliers since startup", example = "60")
    private long anomalyCount;

    @Schema(description = "When the model was last refitted; null if never since startup")
    private Instant lastTrained;

    @Schema(description = "Feedback records received since startup", example = "5")
    private long feedbackReceived;

    @Schema(description = "Location of the persisted model", example = "models/isolation_forest_model.json")
    private String modelPath;

    @Schema(description = "Expected share of outliers in the training data", example = "0.05")
    private double contamination;

    @Schema(description = "Feature column order used for scoring")
    private List<String> featureNames;

    @Schema(description = "Number of trees in the current forest", example = "100")
    private int treeCount;
}
