package com.aiops.anomaly.service;

import com.aiops.anomaly.config.MetricsConfig;
import com.aiops.anomaly.engine.DetectionEngine;
import com.aiops.anomaly.model.AnomalyRecord;
import com.aiops.anomaly.model.AnomalyStats;
import com.aiops.anomaly.model.CanonicalLogRecord;
import com.aiops.anomaly.model.ServiceStats;
import com.aiops.anomaly.repository.AnomalyHistoryRepository;
import com.aiops.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    @Mock private DetectionEngine detectionEngine;
    @Mock private AnomalyHistoryRepository historyRepository;
    @Mock private RateAlertThrottle rateAlertThrottle;
    @Mock private ModelService modelService;
    @Mock private MetricsConfig metricsConfig;

    private AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        service = new AnomalyDetectionService(detectionEngine, historyRepository, rateAlertThrottle,
                modelService, metricsConfig);
    }

    @Test
    void detectAndStore_anomaliesStoredThenThrottled() {
        List<CanonicalLogRecord> records = List.of(
                TestDataFactory.createRecord("line-1", "web_server", TestDataFactory.features("response_time", 5000)),
                TestDataFactory.createRecord("line-2", "web_server", TestDataFactory.features("response_time", 20)));
        AnomalyRecord anomaly = TestDataFactory.createAnomaly("web_server", 1.0, TestDataFactory.BASE_TIME);
        when(detectionEngine.detect(records)).thenReturn(List.of(anomaly));

        List<AnomalyRecord> result = service.detectAndStore(records);

        assertThat(result).containsExactly(anomaly);
        InOrder inOrder = inOrder(metricsConfig, detectionEngine, historyRepository, rateAlertThrottle);
        inOrder.verify(metricsConfig).recordBatch(2);
        inOrder.verify(detectionEngine).detect(records);
        inOrder.verify(historyRepository).appendAll(List.of(anomaly));
        inOrder.verify(rateAlertThrottle).recordAnomalies(List.of(anomaly));
        verify(metricsConfig).recordAnomaly(false);
    }

    @Test
    void detectAndStore_noAnomalies_nothingStored() {
        List<CanonicalLogRecord> records = List.of(
                TestDataFactory.createRecord("line-1", "web_server", TestDataFactory.features("resp_time", 20)));
        when(detectionEngine.detect(records)).thenReturn(List.of());

        assertThat(service.detectAndStore(records)).isEmpty();

        verifyNoInteractions(historyRepository, rateAlertThrottle);
    }

    @Test
    void detectAndStore_emptyBatch_skipsEngine() {
        assertThat(service.detectAndStore(List.of())).isEmpty();

        verifyNoInteractions(detectionEngine, historyRepository, rateAlertThrottle, metricsConfig);
    }

    @Test
    void queriesDelegateToHistory() {
        when(historyRepository.findMostAnomalous(10)).thenReturn(List.of());
        when(historyRepository.getStats()).thenReturn(new AnomalyStats(0, 0.0));
        when(historyRepository.getServiceStats("db")).thenReturn(Optional.of(new ServiceStats()));

        assertThat(service.getRecentAnomalies(10)).isEmpty();
        assertThat(service.getStats().total()).isZero();
        assertThat(service.getServiceStats("db")).isPresent();

        service.clearAnomalies();
        verify(historyRepository).clear();
    }

    @Test
    void isHealthy_followsModel() {
        when(modelService.isHealthy()).thenReturn(true, false);

        assertThat(service.isHealthy()).isTrue();
        assertThat(service.isHealthy()).isFalse();
    }
}
