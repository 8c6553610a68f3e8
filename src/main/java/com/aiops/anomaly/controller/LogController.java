package com.aiops.anomaly.controller;

import com.aiops.anomaly.model.AnomalyRecord;
import com.aiops.anomaly.model.CanonicalLogRecord;
import com.aiops.anomaly.model.StreamRequest;
import com.aiops.anomaly.model.StreamResult;
import com.aiops.anomaly.parser.LogParserService;
import com.aiops.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/logs")
@Tag(name = "Logs", description = "Submit raw log lines for anomaly detection")
public class LogController {

    private static final Logger log = LoggerFactory.getLogger(LogController.class);

    private final LogParserService logParserService;
    private final AnomalyDetectionService detectionService;

    public LogController(LogParserService logParserService, AnomalyDetectionService detectionService) {
        this.logParserService = logParserService;
        this.detectionService = detectionService;
    }

    @Operation(summary = "Detect anomalies in a batch of log lines",
            description = "Parses each line according to its declared format, runs threshold rules and the " +
                    "outlier model, and stores any anomalies. Returns one result per successfully parsed line, " +
                    "in input order. Lines that cannot be parsed or carry no numeric field are skipped.")
    @ApiResponse(responseCode = "200", description = "One result per parsed line",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = StreamResult.class))))
    @ApiResponse(responseCode = "400", description = "No logs in the request")
    @ApiResponse(responseCode = "500", description = "Unexpected failure while processing the batch")
    @PostMapping("/stream")
    public ResponseEntity<?> stream(@RequestBody StreamRequest request) {
        if (request.getLogs() == null || request.getLogs().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "No logs provided in the request."));
        }

        try {
            List<CanonicalLogRecord> parsed = logParserService.parseLogs(request.getLogs());
            List<AnomalyRecord> anomalies = detectionService.detectAndStore(parsed);

            Map<String, AnomalyRecord> byRawLog = new HashMap<>();
            for (AnomalyRecord anomaly : anomalies) {
                byRawLog.put(anomaly.getRawLog(), anomaly);
            }

            List<StreamResult> results = new ArrayList<>(parsed.size());
            for (CanonicalLogRecord record : parsed) {
                AnomalyRecord anomaly = byRawLog.get(record.getRawLog());
                results.add(anomaly != null
                        ? new StreamResult(anomaly.getAnomalyScore(), 1)
                        : new StreamResult(0.0, 0));
            }
            return ResponseEntity.ok(results);
        } catch (Exception e) {
            log.error("Stream processing failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "An internal error occurred during stream processing."));
        }
    }
}
