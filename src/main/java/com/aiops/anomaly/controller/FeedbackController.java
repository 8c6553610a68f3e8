package com.aiops.anomaly.controller;

import com.aiops.anomaly.model.FeedbackRecord;
import com.aiops.anomaly.model.FeedbackRequest;
import com.aiops.anomaly.service.FeedbackService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/feedback")
@Tag(name = "Feedback", description = "Label log lines as anomalous or normal for later retraining")
public class FeedbackController {

    private final FeedbackService feedbackService;

    public FeedbackController(FeedbackService feedbackService) {
        this.feedbackService = feedbackService;
    }

    @Operation(summary = "Submit labelled log lines",
            description = "Each record carries a raw log entry and isAnomaly (0 or 1). Records are appended " +
                    "to the feedback store in the background.")
    @PostMapping
    public ResponseEntity<Map<String, String>> submitFeedback(@RequestBody FeedbackRequest request) {
        if (request.getFeedback() == null || request.getFeedback().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "No feedback records provided."));
        }
        for (FeedbackRecord record : request.getFeedback()) {
            if (record.getLog() == null || (record.getIsAnomaly() != 0 && record.getIsAnomaly() != 1)) {
                return ResponseEntity.badRequest()
                        .body(Map.of("error", "Each feedback record needs a log and isAnomaly of 0 or 1."));
            }
        }

        feedbackService.saveFeedback(request.getFeedback());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("message", "Feedback received for " + request.getFeedback().size() + " records."));
    }
}
