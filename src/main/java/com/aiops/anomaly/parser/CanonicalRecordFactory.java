package com.aiops.anomaly.parser;

import com.aiops.anomaly.model.CanonicalLogRecord;
import com.aiops.anomaly.model.RawLogEntry;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Builds a canonical record from the flat field map produced by a format parser.
 * Shared by every format so level, message, timestamp and feature handling stay identical.
 */
final class CanonicalRecordFactory {

    static final String UNKNOWN_LEVEL = "unknown";

    private static final List<String> TIMESTAMP_KEYS = List.of("timestamp", "@timestamp", "time", "ts");

    private CanonicalRecordFactory() {}

    static CanonicalLogRecord fromFields(RawLogEntry entry, Map<String, ?> fields, Clock clock) {
        Object level = fields.get("level");
        Object message = fields.get("message");

        return CanonicalLogRecord.builder()
                .rawLog(entry.getRawLog())
                .service(entry.getService())
                .source(entry.getSource())
                .timestamp(TimestampNormalizer.normalize(firstTimestamp(fields), clock))
                .logLevel(level != null ? level.toString() : UNKNOWN_LEVEL)
                .message(message != null ? message.toString() : "")
                .features(NumericExtractor.features(fields))
                .build();
    }

    private static Object firstTimestamp(Map<String, ?> fields) {
        for (String key : TIMESTAMP_KEYS) {
            Object value = fields.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
