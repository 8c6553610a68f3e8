package com.aiops.anomaly.engine;

import com.aiops.anomaly.config.DetectionConfig;
import com.aiops.anomaly.config.ModelConfig;
import com.aiops.anomaly.model.AnomalyRecord;
import com.aiops.anomaly.model.CanonicalLogRecord;
import com.aiops.anomaly.model.ScoreBatch;
import com.aiops.anomaly.parser.FeatureVectorizer;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Two-phase anomaly detection over a batch of canonical records.
 *
 * Threshold rules run first. Records that pass every rule are vectorized and scored by the
 * outlier scorer in a single call; a record is a model anomaly only if the scorer labels it
 * an outlier and its score is below the configured cutoff. Results are keyed by raw log
 * text, so at most one anomaly is returned per distinct line.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final ThresholdRuleEvaluator ruleEvaluator;
    private final OutlierScorer scorer;
    private final DetectionConfig detectionConfig;
    private final ModelConfig modelConfig;
    private final Tracer tracer;

    public DetectionEngine(ThresholdRuleEvaluator ruleEvaluator, OutlierScorer scorer,
                           DetectionConfig detectionConfig, ModelConfig modelConfig, Tracer tracer) {
        this.ruleEvaluator = ruleEvaluator;
        this.scorer = scorer;
        this.detectionConfig = detectionConfig;
        this.modelConfig = modelConfig;
        this.tracer = tracer;
    }

    public List<AnomalyRecord> detect(List<CanonicalLogRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }

        Map<String, AnomalyRecord> anomalies = new LinkedHashMap<>();
        List<CanonicalLogRecord> forModel = new ArrayList<>();

        for (CanonicalLogRecord record : records) {
            Optional<AnomalyRecord> violation = ruleEvaluator.evaluate(record);
            if (violation.isPresent()) {
                log.debug("Rule violation for service={}: {}", record.getService(), violation.get().getMessage());
                anomalies.put(record.getRawLog(), violation.get());
            } else {
                forModel.add(record);
            }
        }

        if (!forModel.isEmpty()) {
            for (AnomalyRecord anomaly : scoreWithModel(forModel)) {
                anomalies.put(anomaly.getRawLog(), anomaly);
            }
        }

        return new ArrayList<>(anomalies.values());
    }

    private List<AnomalyRecord> scoreWithModel(List<CanonicalLogRecord> records) {
        List<String> featureNames = modelConfig.getFeatureNames();
        double[][] matrix = FeatureVectorizer.toMatrix(records, featureNames);

        Span span = tracer.nextSpan()
                .name("model.score")
                .tag("batch.size", String.valueOf(records.size()))
                .start();

        ScoreBatch batch;
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            batch = scorer.score(matrix);
        } catch (Exception e) {
            span.error(e);
            log.error("Outlier scorer failed for batch of {} records: {}", records.size(), e.getMessage(), e);
            return List.of();
        } finally {
            span.end();
        }

        if (batch == null || batch.size() != records.size() || batch.labels().size() != records.size()) {
            log.error("Outlier scorer returned {} results for {} records, ignoring model phase",
                    batch == null ? 0 : batch.size(), records.size());
            return List.of();
        }

        double cutoff = detectionConfig.getAnomalyThreshold();
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            double score = batch.scores()[i];
            if (batch.isOutlier(i) && score < cutoff) {
                anomalies.add(modelAnomaly(records.get(i), featureNames, matrix[i], score));
            }
        }
        return anomalies;
    }

    private AnomalyRecord modelAnomaly(CanonicalLogRecord record, List<String> featureNames,
                                       double[] vector, double score) {
        Map<String, Double> features = new LinkedHashMap<>();
        for (int j = 0; j < featureNames.size(); j++) {
            features.put(featureNames.get(j), vector[j]);
        }

        return AnomalyRecord.builder()
                .timestamp(record.getTimestamp())
                .service(record.getService())
                .source(record.getSource())
                .logLevel(record.getLogLevel())
                .message(record.getMessage())
                .anomalyScore(score)
                .ruleViolation(false)
                .features(features)
                .rawLog(record.getRawLog())
                .metadata(new LinkedHashMap<>())
                .context(new LinkedHashMap<>())
                .build();
    }
}
