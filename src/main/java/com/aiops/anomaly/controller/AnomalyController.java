package com.aiops.anomaly.controller;

import com.aiops.anomaly.model.AnomalyRecord;
import com.aiops.anomaly.model.AnomalyStats;
import com.aiops.anomaly.model.ServiceStats;
import com.aiops.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Query and clear the stored anomaly history")
public class AnomalyController {

    private final AnomalyDetectionService detectionService;

    public AnomalyController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Most anomalous stored records",
            description = "Returns stored anomalies ordered by score ascending (most anomalous first), " +
                    "ties broken by earlier timestamp.")
    @GetMapping
    public ResponseEntity<List<AnomalyRecord>> getAnomalies(
            @Parameter(description = "Max number of records to return", example = "100")
            @RequestParam(defaultValue = "100") int limit) {
        if (limit < 0) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(detectionService.getRecentAnomalies(limit));
    }

    @Operation(summary = "Clear anomaly history",
            description = "Removes every stored anomaly and deletes the snapshot file.")
    @DeleteMapping
    public ResponseEntity<Map<String, String>> clearAnomalies() {
        detectionService.clearAnomalies();
        return ResponseEntity.ok(Map.of("message", "All anomaly records have been cleared."));
    }

    @Operation(summary = "Anomaly history statistics",
            description = "Total number of stored anomalies and their mean score.")
    @GetMapping("/stats")
    public ResponseEntity<AnomalyStats> getStats() {
        return ResponseEntity.ok(detectionService.getStats());
    }

    @Operation(summary = "Per-service anomaly statistics",
            description = "Count, mean, min and max score, and anomalies seen in the last hour for one service.")
    @GetMapping("/stats/{service}")
    public ResponseEntity<ServiceStats> getServiceStats(
            @Parameter(description = "Service name", example = "web_server")
            @PathVariable String service) {
        return detectionService.getServiceStats(service)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
