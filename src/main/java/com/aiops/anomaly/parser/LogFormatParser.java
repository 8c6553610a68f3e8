package com.aiops.anomaly.parser;

import com.aiops.anomaly.model.CanonicalLogRecord;
import com.aiops.anomaly.model.LogFormat;
import com.aiops.anomaly.model.RawLogEntry;

import java.util.Optional;

/**
 * Interface for all log format parsers.
 * Each implementation handles a specific LogFormat.
 */
public interface LogFormatParser {

    /**
     * The log format this parser handles.
     */
    LogFormat getSupportedFormat();

    /**
     * Parse one raw log line into its canonical form.
     *
     * @param entry the raw log line with its declared format and optional format config
     * @return the canonical record, or empty when the line cannot be parsed with this format
     */
    Optional<CanonicalLogRecord> parse(RawLogEntry entry);
}
