package com.aiops.anomaly.controller;

import com.aiops.anomaly.model.ModelInfo;
import com.aiops.anomaly.model.TrainRequest;
import com.aiops.anomaly.service.ModelService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Isolation Forest training and metadata")
public class ModelController {

    private final ModelService modelService;

    public ModelController(ModelService modelService) {
        this.modelService = modelService;
    }

    @Operation(summary = "Retrain the outlier model",
            description = "Parses the given logs, fits a new Isolation Forest in the background and swaps it in " +
                    "once training finishes. Batches already being scored keep the previous model.")
    @PostMapping("/train")
    public ResponseEntity<Map<String, String>> train(@RequestBody TrainRequest request) {
        if (request.getLogs() == null || request.getLogs().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "No logs provided for training."));
        }
        modelService.retrain(request.getLogs());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("message", "Model retraining started in the background."));
    }

    @Operation(summary = "Get model metadata",
            description = "Prediction and outlier counters, last training time, feature order and tree count.")
    @GetMapping
    public ResponseEntity<ModelInfo> getModelInfo() {
        return ResponseEntity.ok(modelService.getModelInfo());
    }
}
