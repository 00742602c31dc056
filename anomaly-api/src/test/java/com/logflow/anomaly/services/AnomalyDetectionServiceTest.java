package com.logflow.anomaly.services;

import com.logflow.anomaly.TestSeries;
import com.logflow.anomaly.config.DetectorConfig;
import com.logflow.anomaly.detectors.IsolationForestDetector;
import com.logflow.anomaly.detectors.MovingAverageDetector;
import com.logflow.anomaly.detectors.ZScoreDetector;
import com.logflow.anomaly.dto.AnomalyType;
import com.logflow.anomaly.dto.DetectedAnomalyDto;
import com.logflow.anomaly.dto.MetricType;
import com.logflow.anomaly.exceptions.DetectionRejectedException;
import com.logflow.anomaly.exceptions.DetectionTimeoutException;
import com.logflow.anomaly.exceptions.LogStoreUnavailableException;
import com.logflow.anomaly.source.InMemoryTimeSeriesSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnomalyDetectionServiceTest {

    private final ExecutorService requestExecutor = Executors.newCachedThreadPool();

    @AfterEach
    void shutdown() {
        requestExecutor.shutdownNow();
    }

    private AnomalyDetectionService service(InMemoryTimeSeriesSource source, DetectorConfig config) {
        AnomalyAggregator aggregator = new AnomalyAggregator(List.of(new ZScoreDetector(config),
                new MovingAverageDetector(config), new IsolationForestDetector(config)), config, Runnable::run);
        return new AnomalyDetectionService(source, aggregator, config, requestExecutor);
    }

    @Test
    void detectsLogVolumeSpikeForService() {
        InMemoryTimeSeriesSource source = new InMemoryTimeSeriesSource()
                .with(MetricType.LOG_VOLUME, TestSeries.minutes(10, 10, 10, 10, 10, 10, 100));

        List<DetectedAnomalyDto> anomalies = service(source, DetectorConfig.defaults().build())
                .detectLogVolumeAnomalies("payments", 60);

        assertThat(anomalies).singleElement().satisfies(a -> {
            assertThat(a.getAnomalyType()).isEqualTo(AnomalyType.SPIKE);
            assertThat(a.getService()).isEqualTo("payments");
        });
        assertThat(source.requests()).containsExactly("log_volume:payments:60:1");
    }

    @Test
    void detectsErrorRateDrop() {
        InMemoryTimeSeriesSource source = new InMemoryTimeSeriesSource()
                .with(MetricType.ERROR_RATE, TestSeries.minutes(40, 40, 40, 40, 40, 40, 0));

        List<DetectedAnomalyDto> anomalies = service(source, DetectorConfig.defaults().build())
                .detectErrorRateAnomalies(null, 30);

        assertThat(anomalies).singleElement().satisfies(a -> {
            assertThat(a.getAnomalyType()).isEqualTo(AnomalyType.DROP);
            assertThat(a.getMetricName()).isEqualTo("error_rate");
        });
    }

    @Test
    void emptySeriesIsInsufficientData() {
        DetectionResult result = service(new InMemoryTimeSeriesSource(), DetectorConfig.defaults().build())
                .detect(MetricType.LOG_VOLUME, null, 60);

        assertThat(result.isInsufficientData()).isTrue();
        assertThat(result.getAnomalies()).isEmpty();
    }

    @Test
    void unavailableStorePropagates() {
        AnomalyDetectionService service = service(new InMemoryTimeSeriesSource().unavailable(),
                DetectorConfig.defaults().build());

        assertThatThrownBy(() -> service.detectLogVolumeAnomalies(null, 60))
                .isInstanceOf(LogStoreUnavailableException.class);
    }

    @Test
    void slowStoreHitsRequestTimeout() {
        InMemoryTimeSeriesSource source = new InMemoryTimeSeriesSource()
                .with(MetricType.LOG_VOLUME, TestSeries.minutes(10, 10, 10, 10, 10, 10, 100))
                .delayed(2_000);
        DetectorConfig config = DetectorConfig.defaults().requestTimeout(Duration.ofMillis(100)).build();

        assertThatThrownBy(() -> service(source, config).detectLogVolumeAnomalies(null, 60))
                .isInstanceOf(DetectionTimeoutException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void saturatedRequestExecutorRefusesInsteadOfRunningOnCaller() throws Exception {
        ThreadPoolTaskExecutor saturated = new ThreadPoolTaskExecutor();
        saturated.setCorePoolSize(1);
        saturated.setMaxPoolSize(1);
        saturated.setQueueCapacity(0);
        saturated.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        saturated.initialize();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch busy = new CountDownLatch(1);
        saturated.execute(() -> {
            busy.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        busy.await();

        InMemoryTimeSeriesSource source = new InMemoryTimeSeriesSource()
                .with(MetricType.LOG_VOLUME, TestSeries.minutes(10, 10, 10, 10, 10, 10, 100))
                .delayed(1_500);
        DetectorConfig config = DetectorConfig.defaults().requestTimeout(Duration.ofMillis(200)).build();
        AnomalyAggregator aggregator = new AnomalyAggregator(List.of(new ZScoreDetector(config)), config, Runnable::run);
        AnomalyDetectionService service = new AnomalyDetectionService(source, aggregator, config, saturated);

        try {
            long started = System.nanoTime();
            assertThatThrownBy(() -> service.detectLogVolumeAnomalies(null, 60))
                    .isInstanceOf(DetectionRejectedException.class)
                    .hasMessageContaining("log_volume");
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofMillis(1_000));
            assertThat(source.requests()).isEmpty();
        } finally {
            release.countDown();
            saturated.shutdown();
        }
    }

    @Test
    void rejectsWindowOutsideRange() {
        AnomalyDetectionService service = service(new InMemoryTimeSeriesSource(), DetectorConfig.defaults().build());

        assertThatThrownBy(() -> service.detectLogVolumeAnomalies(null, 9))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.detectErrorRateAnomalies(null, 1441))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
