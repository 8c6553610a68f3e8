package com.aiops.anomaly.parser;

import com.aiops.anomaly.model.CanonicalLogRecord;
import com.aiops.anomaly.model.LogFormat;
import com.aiops.anomaly.model.RawLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parses free-form log lines with a caller-supplied regular expression.
 *
 * The entry's custom config must carry {@code pattern} and a {@code fieldMapping}
 * (or {@code field_mapping}) from 0-based capture group index to field name, e.g.
 * {@code {"0": "timestamp", "2": "resp_time"}}. The first match anywhere in the line is used.
 */
@Component
public class RegexLogParser implements LogFormatParser {

    private static final Logger log = LoggerFactory.getLogger(RegexLogParser.class);

    static final String PATTERN_KEY = "pattern";
    static final String FIELD_MAPPING_KEY = "fieldMapping";
    static final String FIELD_MAPPING_ALT_KEY = "field_mapping";

    private final Clock clock;

    // Compiled patterns keyed by their source text
    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public RegexLogParser(Clock clock) {
        this.clock = clock;
    }

    @Override
    public LogFormat getSupportedFormat() {
        return LogFormat.REGEX;
    }

    @Override
    public Optional<CanonicalLogRecord> parse(RawLogEntry entry) {
        Map<String, Object> config = entry.getCustomConfig();
        if (config == null || entry.getRawLog() == null) {
            log.debug("Regex log from service={} has no custom config, skipping", entry.getService());
            return Optional.empty();
        }

        Object patternSource = config.get(PATTERN_KEY);
        Object mapping = config.containsKey(FIELD_MAPPING_KEY)
                ? config.get(FIELD_MAPPING_KEY)
                : config.get(FIELD_MAPPING_ALT_KEY);
        if (!(patternSource instanceof String regex) || !(mapping instanceof Map<?, ?> fieldMapping)) {
            log.debug("Regex log from service={} is missing pattern or field mapping, skipping", entry.getService());
            return Optional.empty();
        }

        Optional<Pattern> pattern = compile(regex);
        if (pattern.isEmpty()) {
            return Optional.empty();
        }

        Matcher m = pattern.get().matcher(entry.getRawLog());
        if (!m.find()) {
            log.debug("Regex pattern did not match log from service={}", entry.getService());
            return Optional.empty();
        }

        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < m.groupCount(); i++) {
            Object fieldName = fieldMapping.get(String.valueOf(i));
            String value = m.group(i + 1);
            if (fieldName != null && value != null) {
                fields.put(fieldName.toString(), value);
            }
        }

        return Optional.of(CanonicalRecordFactory.fromFields(entry, fields, clock));
    }

    private Optional<Pattern> compile(String regex) {
        Pattern cached = patternCache.get(regex);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            Pattern compiled = Pattern.compile(regex);
            patternCache.put(regex, compiled);
            return Optional.of(compiled);
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regex pattern '{}': {}", regex, e.getDescription());
            return Optional.empty();
        }
    }
}
