package com.aiops.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A user-provided label for one log line")
public class FeedbackRecord {

    @Schema(description = "The labelled log line")
    private RawLogEntry log;

    @Schema(description = "1 = anomaly, 0 = normal", example = "1")
    private int isAnomaly;
}
