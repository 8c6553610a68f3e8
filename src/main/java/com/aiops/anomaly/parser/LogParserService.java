package com.aiops.anomaly.parser;

import com.aiops.anomaly.config.MetricsConfig;
import com.aiops.anomaly.model.CanonicalLogRecord;
import com.aiops.anomaly.model.LogFormat;
import com.aiops.anomaly.model.RawLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Normalizes batches of raw log lines into canonical records.
 * Each {@link LogFormat} is handled by the registered {@link LogFormatParser} for it.
 */
@Service
public class LogParserService {

    private static final Logger log = LoggerFactory.getLogger(LogParserService.class);

    private final Map<LogFormat, LogFormatParser> parserMap;
    private final MetricsConfig metricsConfig;

    public LogParserService(List<LogFormatParser> parsers, MetricsConfig metricsConfig) {
        this.parserMap = new EnumMap<>(LogFormat.class);
        this.metricsConfig = metricsConfig;

        for (LogFormatParser parser : parsers) {
            parserMap.put(parser.getSupportedFormat(), parser);
            log.info("Registered log parser: {} -> {}",
                    parser.getSupportedFormat(), parser.getClass().getSimpleName());
        }
    }

    /**
     * Parse a batch of raw log lines.
     *
     * @return canonical records in input order; lines that cannot be parsed or carry
     *         no numeric feature are dropped
     */
    public List<CanonicalLogRecord> parseLogs(List<RawLogEntry> entries) {
        List<CanonicalLogRecord> records = new ArrayList<>(entries.size());
        for (RawLogEntry entry : entries) {
            parse(entry).ifPresent(records::add);
        }
        return records;
    }

    public Optional<CanonicalLogRecord> parse(RawLogEntry entry) {
        LogFormat format = entry.getFormatType();
        String formatTag = format != null ? format.getWireName() : "none";

        LogFormatParser parser = format != null ? parserMap.get(format) : null;
        if (parser == null) {
            log.warn("No parser registered for format {} (service={})", formatTag, entry.getService());
            metricsConfig.recordParseDrop(formatTag, "unsupported_format");
            return Optional.empty();
        }

        Optional<CanonicalLogRecord> parsed;
        try {
            parsed = parser.parse(entry);
        } catch (Exception e) {
            log.error("Error parsing {} log from service={}: {}",
                    formatTag, entry.getService(), e.getMessage(), e);
            metricsConfig.recordParseDrop(formatTag, "error");
            return Optional.empty();
        }

        if (parsed.isEmpty()) {
            metricsConfig.recordParseDrop(formatTag, "unparseable");
            return Optional.empty();
        }
        if (parsed.get().getFeatures().isEmpty()) {
            log.debug("Dropping {} log from service={}: no numeric features", formatTag, entry.getService());
            metricsConfig.recordParseDrop(formatTag, "no_features");
            return Optional.empty();
        }
        return parsed;
    }
}
