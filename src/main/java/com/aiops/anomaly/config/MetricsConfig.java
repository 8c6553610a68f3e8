package com.aiops.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger historySize;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.historySize = registry.gauge("history.size", new AtomicInteger(0));
    }

    public void recordBatch(int parsedCount) {
        DistributionSummary.builder("detection.batch.size")
                .register(registry)
                .record(parsedCount);
    }

    public void recordAnomaly(boolean ruleViolation) {
        Counter.builder("detection.anomalies")
                .tag("path", ruleViolation ? "rule" : "model")
                .register(registry)
                .increment();
    }

    public void recordPredictions(int count, int outliers) {
        Counter.builder("model.predictions")
                .register(registry)
                .increment(count);
        Counter.builder("model.outliers")
                .register(registry)
                .increment(outliers);
    }

    public void recordParseDrop(String format, String reason) {
        Counter.builder("log.parse.dropped")
                .tag("format", format)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRateAlert(String service) {
        Counter.builder("rate.alert.fired")
                .tag("service", service)
                .register(registry)
                .increment();
    }

    public void recordSinkDelivery(String sink, String status) {
        Counter.builder("alert.sink.delivery")
                .tag("sink", sink)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateHistorySize(int size) {
        historySize.set(size);
    }
}
