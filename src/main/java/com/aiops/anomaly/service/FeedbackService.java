package com.aiops.anomaly.service;

import com.aiops.anomaly.config.FeedbackConfig;
import com.aiops.anomaly.model.FeedbackRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends labelled log lines to a JSON array file for later retraining.
 */
@Service
public class FeedbackService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    private final Path storePath;
    private final ModelService modelService;
    private final ObjectMapper objectMapper;
    private final Object storeLock = new Object();

    public FeedbackService(FeedbackConfig feedbackConfig, ModelService modelService) {
        this.storePath = Paths.get(feedbackConfig.getStorePath());
        this.modelService = modelService;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Async
    public void saveFeedback(List<FeedbackRecord> records) {
        if (records.isEmpty()) {
            return;
        }

        synchronized (storeLock) {
            try {
                ArrayNode stored = readStore();
                for (FeedbackRecord record : records) {
                    stored.add(objectMapper.valueToTree(record));
                }
                Path dir = storePath.toAbsolutePath().getParent();
                if (dir != null) {
                    Files.createDirectories(dir);
                }
                objectMapper.writeValue(storePath.toFile(), stored);
                modelService.incrementFeedback(records.size());
                log.info("Saved {} feedback records to {}", records.size(), storePath);
            } catch (IOException e) {
                log.error("Error saving feedback to {}", storePath, e);
            }
        }
    }

    /**
     * Every stored feedback entry, oldest first.
     */
    public List<JsonNode> findAll() {
        synchronized (storeLock) {
            try {
                List<JsonNode> entries = new ArrayList<>();
                readStore().forEach(entries::add);
                return entries;
            } catch (IOException e) {
                log.error("Error reading feedback from {}", storePath, e);
                return List.of();
            }
        }
    }

    private ArrayNode readStore() throws IOException {
        if (!Files.exists(storePath) || Files.size(storePath) == 0) {
            return objectMapper.createArrayNode();
        }
        JsonNode node = objectMapper.readTree(storePath.toFile());
        if (node == null || !node.isArray()) {
            throw new IOException("Feedback store " + storePath + " does not contain a JSON array");
        }
        return (ArrayNode) node;
    }
}
