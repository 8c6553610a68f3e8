package com.aiops.anomaly.model;

import com.aiops.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnomalyRecordTest {

    @Test
    void builder_copiesMapsSoLaterSourceChangesAreNotSeen() {
        Map<String, Double> features = new HashMap<>(Map.of("response_time", 5000.0));
        Map<String, Object> metadata = new HashMap<>(Map.of("violated_rule", "response_time"));

        AnomalyRecord record = AnomalyRecord.builder()
                .timestamp(TestDataFactory.BASE_TIME)
                .service("web_server")
                .anomalyScore(1.0)
                .ruleViolation(true)
                .features(features)
                .rawLog("line")
                .metadata(metadata)
                .build();
        features.put("response_time", 1.0);
        metadata.clear();

        assertThat(record.getFeatures()).containsEntry("response_time", 5000.0);
        assertThat(record.getMetadata()).containsEntry("violated_rule", "response_time");
        assertThat(record.getContext()).isEmpty();
    }

    @Test
    void getters_returnReadOnlyMaps() {
        AnomalyRecord record = TestDataFactory.createAnomaly("web_server", -0.2, TestDataFactory.BASE_TIME);

        assertThatThrownBy(() -> record.getFeatures().put("resp_time", 0.0))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> record.getMetadata().put("k", "v"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> record.getContext().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
