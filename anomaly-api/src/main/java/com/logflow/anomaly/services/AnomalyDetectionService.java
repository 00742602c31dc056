package com.logflow.anomaly.services;

import com.logflow.anomaly.config.AnomalyDetectionConfig;
import com.logflow.anomaly.config.DetectorConfig;
import com.logflow.anomaly.dto.DetectedAnomalyDto;
import com.logflow.anomaly.dto.MetricType;
import com.logflow.anomaly.dto.TimeBucket;
import com.logflow.anomaly.exceptions.DetectionRejectedException;
import com.logflow.anomaly.exceptions.DetectionTimeoutException;
import com.logflow.anomaly.source.TimeSeriesSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Entry point for detection requests: reads the series for a metric and hands it to the
 * {@link AnomalyAggregator}, bounded by the configured request timeout.
 */
@Slf4j
@Service
public class AnomalyDetectionService {

    public static final int MIN_WINDOW_MINUTES = 10;
    public static final int MAX_WINDOW_MINUTES = 1440;

    private final TimeSeriesSource timeSeriesSource;
    private final AnomalyAggregator aggregator;
    private final DetectorConfig config;
    private final Executor requestExecutor;

    public AnomalyDetectionService(TimeSeriesSource timeSeriesSource, AnomalyAggregator aggregator, DetectorConfig config,
                                   @Qualifier(AnomalyDetectionConfig.REQUEST_EXECUTOR) Executor requestExecutor) {
        this.timeSeriesSource = timeSeriesSource;
        this.aggregator = aggregator;
        this.config = config;
        this.requestExecutor = requestExecutor;
    }

    public List<DetectedAnomalyDto> detectLogVolumeAnomalies(String service, int windowMinutes) {
        return detect(MetricType.LOG_VOLUME, service, windowMinutes).getAnomalies();
    }

    public List<DetectedAnomalyDto> detectErrorRateAnomalies(String service, int windowMinutes) {
        return detect(MetricType.ERROR_RATE, service, windowMinutes).getAnomalies();
    }

    public DetectionResult detect(MetricType metric, String service, int windowMinutes) {
        validateWindow(windowMinutes);
        return withinDeadline(() -> detectUnbounded(metric, service, windowMinutes),
                metric.metricName() + " detection");
    }

    /** Fetches and analyses one metric on the calling thread, without the request deadline. */
    DetectionResult detectUnbounded(MetricType metric, String service, int windowMinutes) {
        List<TimeBucket> series = timeSeriesSource.queryBucketedCounts(metric, service, windowMinutes,
                config.getBucketWidthMinutes());
        log.info("Got {} time series points for {} anomaly detection", series.size(), metric.metricName());
        return aggregator.aggregate(metric, service, series);
    }

    /**
     * Runs the work on the request executor and waits at most {@code requestTimeout}. On expiry
     * the task is cancelled and whatever it produced is discarded. A saturated executor refuses
     * the work with {@link DetectionRejectedException}.
     */
    <T> T withinDeadline(Supplier<T> work, String description) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(work, requestExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("{} rejected, no request worker available", description);
            throw new DetectionRejectedException(description + " rejected, detection capacity exhausted", e);
        }
        long timeoutMillis = config.getRequestTimeout().toMillis();
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} exceeded {} ms, discarding partial results", description, timeoutMillis);
            throw new DetectionTimeoutException(description + " timed out after " + timeoutMillis + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DetectionTimeoutException(description + " was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(description + " failed", cause);
        }
    }

    public static void validateWindow(int windowMinutes) {
        if (windowMinutes < MIN_WINDOW_MINUTES || windowMinutes > MAX_WINDOW_MINUTES) {
            throw new IllegalArgumentException("window_minutes must be within [" + MIN_WINDOW_MINUTES + ", "
                    + MAX_WINDOW_MINUTES + "], was " + windowMinutes);
        }
    }
}
