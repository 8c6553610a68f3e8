package com.aiops.anomaly.parser;

import com.aiops.anomaly.model.CanonicalLogRecord;
import com.aiops.anomaly.model.LogFormat;
import com.aiops.anomaly.model.RawLogEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parses structured (JSON object) log lines.
 *
 * Top-level numbers become features directly, booleans become 1 or 0, and text values
 * become features when they contain a number. Nulls, arrays and nested objects are kept
 * as fields but never become features.
 */
@Component
public class JsonLogParser implements LogFormatParser {

    private static final Logger log = LoggerFactory.getLogger(JsonLogParser.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonLogParser(Clock clock) {
        this.objectMapper = new ObjectMapper();
        this.clock = clock;
    }

    @Override
    public LogFormat getSupportedFormat() {
        return LogFormat.JSON;
    }

    @Override
    public Optional<CanonicalLogRecord> parse(RawLogEntry entry) {
        JsonNode root;
        try {
            root = objectMapper.readTree(entry.getRawLog());
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON log from service={}: {}", entry.getService(), e.getOriginalMessage());
            return Optional.empty();
        }

        if (root == null || !root.isObject()) {
            log.warn("JSON log from service={} is not an object, skipping", entry.getService());
            return Optional.empty();
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            Object value = toFieldValue(field.getValue());
            if (value != null) {
                fields.put(field.getKey(), value);
            }
        }

        return Optional.of(CanonicalRecordFactory.fromFields(entry, fields, clock));
    }

    private Object toFieldValue(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        // arrays and objects: retained, never numeric
        return node;
    }
}
