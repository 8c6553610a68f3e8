package com.aiops.anomaly.service;

import com.aiops.anomaly.config.MetricsConfig;
import com.aiops.anomaly.config.ModelConfig;
import com.aiops.anomaly.engine.OutlierScorer;
import com.aiops.anomaly.engine.isolationforest.IsolationForestScorer;
import com.aiops.anomaly.model.CanonicalLogRecord;
import com.aiops.anomaly.model.ModelInfo;
import com.aiops.anomaly.model.RawLogEntry;
import com.aiops.anomaly.model.ScoreBatch;
import com.aiops.anomaly.parser.FeatureVectorizer;
import com.aiops.anomaly.parser.LogParserService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the current outlier model. Scoring always goes through the reference held here,
 * and retraining replaces that reference in one step, so a batch in flight keeps the
 * model it started with.
 */
@Service
public class ModelService implements OutlierScorer {

    private static final Logger log = LoggerFactory.getLogger(ModelService.class);

    static final int BOOTSTRAP_ROWS = 100;
    static final double BOOTSTRAP_RANGE = 100.0;

    private final ModelConfig config;
    private final LogParserService logParserService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final AtomicReference<IsolationForestScorer> current = new AtomicReference<>();
    private final AtomicLong predictionCount = new AtomicLong();
    private final AtomicLong outlierCount = new AtomicLong();
    private final AtomicLong feedbackReceived = new AtomicLong();
    private volatile Instant lastTrained;

    public ModelService(ModelConfig config, LogParserService logParserService,
                        MetricsConfig metricsConfig, Clock clock) {
        this.config = config;
        this.logParserService = logParserService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        Path path = Paths.get(config.getPath());
        if (Files.exists(path)) {
            try {
                IsolationForestScorer loaded = objectMapper.readValue(path.toFile(), IsolationForestScorer.class);
                if (loaded.getForest().getFeatureCount() == config.getFeatureNames().size()) {
                    current.set(loaded);
                    log.info("Loaded model from {} ({} trees)", path, loaded.getForest().getTrees().size());
                    return;
                }
                log.warn("Model at {} expects {} features but {} are configured, refitting",
                        path, loaded.getForest().getFeatureCount(), config.getFeatureNames().size());
            } catch (IOException | IllegalArgumentException e) {
                log.error("Failed to load model from {}, refitting", path, e);
            }
        }

        log.info("No usable model at {}, fitting an initial model on synthetic data", path);
        IsolationForestScorer initial = fit(bootstrapData());
        current.set(initial);
        save(initial);
    }

    @Override
    public ScoreBatch score(double[][] rows) {
        IsolationForestScorer scorer = current.get();
        if (scorer == null) {
            throw new IllegalStateException("Model is not initialized");
        }
        ScoreBatch batch = scorer.score(rows);

        int outliers = 0;
        for (int i = 0; i < batch.size(); i++) {
            if (batch.isOutlier(i)) outliers++;
        }
        predictionCount.addAndGet(batch.size());
        outlierCount.addAndGet(outliers);
        metricsConfig.recordPredictions(batch.size(), outliers);
        return batch;
    }

    /**
     * Refit on the given logs and swap the model in. Runs off the request thread;
     * failures are logged and the current model stays in place.
     */
    @Async
    public void retrain(List<RawLogEntry> logs) {
        try {
            List<CanonicalLogRecord> records = logParserService.parseLogs(logs);
            if (records.size() < config.getMinTrainSamples()) {
                log.warn("Not enough training samples: {} parsed, {} required. Keeping current model.",
                        records.size(), config.getMinTrainSamples());
                return;
            }

            double[][] data = FeatureVectorizer.toMatrix(records, config.getFeatureNames());
            IsolationForestScorer retrained = fit(data);
            current.set(retrained);
            lastTrained = clock.instant();
            save(retrained);
            log.info("Model retrained on {} samples", data.length);
        } catch (Exception e) {
            log.error("Model retraining failed: {}", e.getMessage(), e);
        }
    }

    public void incrementFeedback(int count) {
        feedbackReceived.addAndGet(count);
    }

    public boolean isHealthy() {
        return current.get() != null;
    }

    public ModelInfo getModelInfo() {
        IsolationForestScorer scorer = current.get();
        return ModelInfo.builder()
                .predictionCount(predictionCount.get())
                .anomalyCount(outlierCount.get())
                .lastTrained(lastTrained)
                .feedbackReceived(feedbackReceived.get())
                .modelPath(config.getPath())
                .contamination(config.getContamination())
                .featureNames(List.copyOf(config.getFeatureNames()))
                .treeCount(scorer != null ? scorer.getForest().getTrees().size() : 0)
                .build();
    }

    private IsolationForestScorer fit(double[][] data) {
        return IsolationForestScorer.fit(data, config.getNumTrees(), config.getSampleSize(),
                config.getContamination(), config.getSeed());
    }

    private double[][] bootstrapData() {
        Random random = new Random(config.getSeed());
        double[][] data = new double[BOOTSTRAP_ROWS][config.getFeatureNames().size()];
        for (double[] row : data) {
            for (int j = 0; j < row.length; j++) {
                row[j] = random.nextDouble() * BOOTSTRAP_RANGE;
            }
        }
        return data;
    }

    private void save(IsolationForestScorer scorer) {
        Path path = Paths.get(config.getPath());
        try {
            Path dir = path.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            objectMapper.writeValue(path.toFile(), scorer);
            log.info("Saved model to {}", path);
        } catch (IOException e) {
            log.error("Failed to save model to {}", path, e);
        }
    }
}
