package com.aiops.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A raw log line from one service, with its declared format")
public class RawLogEntry {

    @Schema(description = "Raw log line",
            example = "{\"timestamp\": \"2024-01-01T10:00:00Z\", \"level\": \"ERROR\", \"response_time\": 5000}")
    private String rawLog;

    @Schema(description = "Service name", example = "web_server")
    private String service;

    @Schema(description = "Log source identifier", example = "nginx")
    private String source;

    @Schema(description = "Declared log format", example = "json")
    private LogFormat formatType;

    @Schema(description = "Format-specific configuration. The regex format needs 'pattern' and 'fieldMapping' " +
            "(capture group index, 0-based, to field name).",
            example = "{\"pattern\": \"(\\\\S+) (\\\\w+) took (\\\\d+)ms\", \"fieldMapping\": {\"0\": \"timestamp\", \"1\": \"level\", \"2\": \"resp_time\"}}")
    private Map<String, Object> customConfig;
}
