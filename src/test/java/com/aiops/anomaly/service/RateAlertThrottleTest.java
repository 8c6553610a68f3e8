package com.aiops.anomaly.service;

import com.aiops.anomaly.alert.AlertManager;
import com.aiops.anomaly.config.DetectionConfig;
import com.aiops.anomaly.config.MetricsConfig;
import com.aiops.anomaly.model.AnomalyRecord;
import com.aiops.anomaly.model.RateAlertRule;
import com.aiops.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.aiops.anomaly.testutil.TestDataFactory.BASE_TIME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RateAlertThrottleTest {

    @Mock private AlertManager alertManager;
    @Mock private MetricsConfig metricsConfig;

    private DetectionConfig config;
    private RateAlertThrottle throttle;

    @BeforeEach
    void setUp() {
        config = TestDataFactory.createDetectionConfig();
        config.getRateAlerts().getServices().put("db", new RateAlertRule(10, 60));
        throttle = new RateAlertThrottle(config, alertManager, metricsConfig);
    }

    @Test
    void twoBatchesReachingCount_fireOnceThenReset() {
        List<AnomalyRecord> first = TestDataFactory.createAnomalies("db", 6, BASE_TIME, 1);
        List<AnomalyRecord> second = TestDataFactory.createAnomalies("db", 6, BASE_TIME.plusSeconds(6), 1);

        assertThat(throttle.recordAnomalies(first)).isEmpty();
        assertThat(throttle.getWindowSize("db")).isEqualTo(6);
        verifyNoInteractions(alertManager);

        assertThat(throttle.recordAnomalies(second)).containsExactly("db");
        verify(alertManager, times(1)).sendAlert(
                eq("High Anomaly Rate Detected for service: db"), anyMap(), eq("high_anomaly_rate"));
        // the window was cleared at the 10th anomaly; the last two of the batch remain
        assertThat(throttle.getWindowSize("db")).isEqualTo(2);

        assertThat(throttle.recordAnomalies(
                TestDataFactory.createAnomalies("db", 1, BASE_TIME.plusSeconds(20), 1))).isEmpty();
        verify(alertManager, times(1)).sendAlert(anyString(), anyMap(), anyString());
    }

    @Test
    @SuppressWarnings("unchecked")
    void alertDetails_describeRuleAndWindow() {
        throttle.recordAnomalies(TestDataFactory.createAnomalies("web_server", 3, BASE_TIME, 5));

        ArgumentCaptor<Map<String, Object>> details = ArgumentCaptor.forClass(Map.class);
        verify(alertManager).sendAlert(anyString(), details.capture(), eq(RateAlertThrottle.ALERT_TYPE));
        assertThat(details.getValue())
                .containsEntry("service", "web_server")
                .containsEntry("rule_violated", Map.of("count", 3, "window_seconds", 60L))
                .containsEntry("anomaly_count_in_window", 3)
                .containsEntry("time_window_seconds", 60L)
                .containsEntry("last_anomaly_timestamp", BASE_TIME.plusSeconds(10).toString());
        verify(metricsConfig).recordRateAlert("web_server");
    }

    @Test
    void anomaliesOutsideWindow_evictedRelativeToAnomalyTime() {
        // web_server: 3 within 60s
        throttle.recordAnomalies(TestDataFactory.createAnomalies("web_server", 2, BASE_TIME, 1));
        throttle.recordAnomalies(TestDataFactory.createAnomalies("web_server", 1, BASE_TIME.plusSeconds(120), 1));

        assertThat(throttle.getWindowSize("web_server")).isEqualTo(1);
        verifyNoInteractions(alertManager);
    }

    @Test
    void timestampExactlyAtWindowStart_isKept() {
        throttle.recordAnomalies(TestDataFactory.createAnomalies("web_server", 1, BASE_TIME, 1));
        throttle.recordAnomalies(TestDataFactory.createAnomalies("web_server", 1, BASE_TIME.plusSeconds(60), 1));

        assertThat(throttle.getWindowSize("web_server")).isEqualTo(2);
    }

    @Test
    void unknownServiceFallsBackToDefaultRule() {
        throttle.recordAnomalies(TestDataFactory.createAnomalies("batch_jobs", 9, BASE_TIME, 1));
        verifyNoInteractions(alertManager);

        assertThat(throttle.recordAnomalies(
                TestDataFactory.createAnomalies("batch_jobs", 1, BASE_TIME.plusSeconds(30), 1)))
                .containsExactly("batch_jobs");
    }

    @Test
    void noRuleAndNoDefault_skipsWithoutState() {
        config.getRateAlerts().setDefaults(null);
        RateAlertThrottle noDefault = new RateAlertThrottle(config, alertManager, metricsConfig);

        assertThat(noDefault.recordAnomalies(TestDataFactory.createAnomalies("batch_jobs", 50, BASE_TIME, 1)))
                .isEmpty();
        assertThat(noDefault.getWindowSize("batch_jobs")).isZero();
        verifyNoInteractions(alertManager);
    }

    @Test
    void servicesHaveIndependentWindows() {
        throttle.recordAnomalies(TestDataFactory.createAnomalies("web_server", 2, BASE_TIME, 1));
        throttle.recordAnomalies(TestDataFactory.createAnomalies("database", 4, BASE_TIME, 1));

        assertThat(throttle.getWindowSize("web_server")).isEqualTo(2);
        assertThat(throttle.getWindowSize("database")).isEqualTo(4);
        verifyNoInteractions(alertManager);
    }

    @Test
    void reset_clearsAllWindows() {
        throttle.recordAnomalies(TestDataFactory.createAnomalies("web_server", 2, BASE_TIME, 1));

        throttle.reset();

        assertThat(throttle.getWindowSize("web_server")).isZero();
    }

    @Test
    void concurrentRecording_firesExactlyOncePerCountAnomalies() throws Exception {
        config.getRateAlerts().getServices().put("hot", new RateAlertRule(10, 3600));
        RateAlertThrottle shared = new RateAlertThrottle(config, alertManager, metricsConfig);

        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger fired = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    Set<String> result = shared.recordAnomalies(
                            List.of(TestDataFactory.createAnomaly("hot", 0.0, BASE_TIME)));
                    fired.addAndGet(result.size());
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(fired.get()).isEqualTo(threads * perThread / 10);
        assertThat(shared.getWindowSize("hot")).isZero();
        verify(alertManager, times(threads * perThread / 10)).sendAlert(anyString(), anyMap(), anyString());
    }
}
