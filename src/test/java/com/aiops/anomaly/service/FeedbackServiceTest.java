package com.aiops.anomaly.service;

import com.aiops.anomaly.config.FeedbackConfig;
import com.aiops.anomaly.model.FeedbackRecord;
import com.aiops.anomaly.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeedbackServiceTest {

    @TempDir
    Path tempDir;

    @Mock private ModelService modelService;

    private Path store;
    private FeedbackService feedbackService;

    @BeforeEach
    void setUp() {
        store = tempDir.resolve("feedback/labeled_data.json");
        FeedbackConfig config = new FeedbackConfig();
        config.setStorePath(store.toString());
        feedbackService = new FeedbackService(config, modelService);
    }

    @Test
    void saveFeedback_createsStoreAndAppends() {
        feedbackService.saveFeedback(List.of(new FeedbackRecord(
                TestDataFactory.jsonLog("{\"resp_time\": 9000}", "web_server"), 1)));
        feedbackService.saveFeedback(List.of(new FeedbackRecord(
                TestDataFactory.keyValueLog("resp_time=20", "web_server"), 0)));

        List<JsonNode> stored = feedbackService.findAll();
        assertThat(stored).hasSize(2);
        assertThat(stored.get(0).get("isAnomaly").asInt()).isEqualTo(1);
        assertThat(stored.get(0).get("log").get("formatType").asText()).isEqualTo("json");
        assertThat(stored.get(1).get("log").get("rawLog").asText()).isEqualTo("resp_time=20");
        verify(modelService, times(2)).incrementFeedback(1);
    }

    @Test
    void saveFeedback_emptyBatch_noFileWritten() {
        feedbackService.saveFeedback(List.of());

        assertThat(store).doesNotExist();
        verifyNoInteractions(modelService);
    }

    @Test
    void saveFeedback_unreadableStore_logsAndLeavesFileUntouched() throws Exception {
        Files.createDirectories(store.getParent());
        Files.writeString(store, "{\"not\": \"an array\"}");

        feedbackService.saveFeedback(List.of(new FeedbackRecord(
                TestDataFactory.keyValueLog("resp_time=20", "svc"), 0)));

        assertThat(Files.readString(store)).isEqualTo("{\"not\": \"an array\"}");
        verify(modelService, never()).incrementFeedback(anyInt());
    }
}
