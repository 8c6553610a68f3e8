package com.aiops.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A batch of raw log lines from one or more services")
public class StreamRequest {

    @Schema(description = "Raw log records to analyse")
    private List<RawLogEntry> logs;

    @Schema(description = "Optional metadata tags")
    @Builder.Default
    private Map<String, String> tags = new HashMap<>();
}
