package com.aiops.anomaly.parser;

import com.aiops.anomaly.model.CanonicalLogRecord;
import com.aiops.anomaly.model.LogFormat;
import com.aiops.anomaly.model.RawLogEntry;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code key=value} log lines. Values are either double-quoted (quotes stripped)
 * or run until the next whitespace character. Text outside pairs is ignored.
 */
@Component
public class KeyValueLogParser implements LogFormatParser {

    private static final Pattern PAIR = Pattern.compile("(\\w+)=(\".*?\"|\\S+)");

    private final Clock clock;

    public KeyValueLogParser(Clock clock) {
        this.clock = clock;
    }

    @Override
    public LogFormat getSupportedFormat() {
        return LogFormat.KEY_VALUE;
    }

    @Override
    public Optional<CanonicalLogRecord> parse(RawLogEntry entry) {
        if (entry.getRawLog() == null) {
            return Optional.empty();
        }

        Map<String, String> fields = new LinkedHashMap<>();
        Matcher m = PAIR.matcher(entry.getRawLog());
        while (m.find()) {
            fields.put(m.group(1), stripQuotes(m.group(2)));
        }

        return Optional.of(CanonicalRecordFactory.fromFields(entry, fields, clock));
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '"') start++;
        while (end > start && value.charAt(end - 1) == '"') end--;
        return value.substring(start, end);
    }
}
