package com.aiops.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Declared format of a raw log line. Each value is handled by exactly one
 * {@link com.aiops.anomaly.parser.LogFormatParser}.
 */
public enum LogFormat {

    JSON("json"),
    KEY_VALUE("key_value"),
    REGEX("regex");

    private final String wireName;

    LogFormat(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static LogFormat fromWireName(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "json":
            case "structured":
                return JSON;
            case "key_value":
            case "key-value":
            case "kv":
                return KEY_VALUE;
            case "regex":
            case "pattern":
                return REGEX;
            default:
                throw new IllegalArgumentException("Unsupported log format: " + value);
        }
    }
}
