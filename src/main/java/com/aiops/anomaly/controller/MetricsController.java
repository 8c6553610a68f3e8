package com.aiops.anomaly.controller;

import com.aiops.anomaly.model.AnomalyStats;
import com.aiops.anomaly.model.MetricsResponse;
import com.aiops.anomaly.model.ModelInfo;
import com.aiops.anomaly.service.AnomalyDetectionService;
import com.aiops.anomaly.service.ModelService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/metrics")
@Tag(name = "Metrics", description = "High-level service and model counters")
public class MetricsController {

    private final ModelService modelService;
    private final AnomalyDetectionService detectionService;

    public MetricsController(ModelService modelService, AnomalyDetectionService detectionService) {
        this.modelService = modelService;
        this.detectionService = detectionService;
    }

    @Operation(summary = "Service metrics",
            description = "Prediction count, stored anomaly count, last training time, feedback received " +
                    "and the mean score of stored anomalies.")
    @GetMapping
    public ResponseEntity<MetricsResponse> getMetrics() {
        ModelInfo model = modelService.getModelInfo();
        AnomalyStats stats = detectionService.getStats();
        return ResponseEntity.ok(MetricsResponse.builder()
                .predictionCount(model.getPredictionCount())
                .anomalyCount(stats.total())
                .lastTrained(model.getLastTrained())
                .feedbackReceived(model.getFeedbackReceived())
                .avgScore(stats.avgScore())
                .build());
    }
}
