package com.logflow.anomaly.services;

import com.logflow.anomaly.config.AnomalyDetectionConfig;
import com.logflow.anomaly.config.DetectorConfig;
import com.logflow.anomaly.detectors.AnomalyMethod;
import com.logflow.anomaly.detectors.SeriesContext;
import com.logflow.anomaly.dto.DetectedAnomalyDto;
import com.logflow.anomaly.dto.MetricType;
import com.logflow.anomaly.dto.TimeBucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs every enabled detection method over one series, merges their candidates and keeps a
 * single verdict per {@code (detectedAt, metricName)}.
 */
@Slf4j
@Service
public class AnomalyAggregator {

    /** Highest severity first, then highest score. */
    static final Comparator<DetectedAnomalyDto> RANKING = Comparator
            .comparingInt((DetectedAnomalyDto a) -> a.getSeverity().rank())
            .thenComparingDouble(DetectedAnomalyDto::getScore);

    static final Comparator<DetectedAnomalyDto> MOST_RECENT_FIRST = Comparator
            .comparing(DetectedAnomalyDto::getDetectedAt, Comparator.reverseOrder())
            .thenComparing(DetectedAnomalyDto::getMetricName);

    private final List<AnomalyMethod> methods;
    private final DetectorConfig config;
    private final Executor executor;

    public AnomalyAggregator(List<AnomalyMethod> methods, DetectorConfig config,
                             @Qualifier(AnomalyDetectionConfig.DETECTOR_EXECUTOR) Executor executor) {
        this.methods = methods.stream()
                .sorted(Comparator.comparing(AnomalyMethod::method))
                .toList();
        this.config = config;
        this.executor = executor;
    }

    public DetectionResult aggregate(MetricType metric, String service, List<TimeBucket> series) {
        if (!config.isEnabled()) {
            return DetectionResult.of(metric, service, series.size(), List.of());
        }
        if (series.size() < config.getMinSamples()) {
            log.debug("Not enough samples for {}: {} < {}", metric.metricName(), series.size(), config.getMinSamples());
            return DetectionResult.insufficientData(metric, service, series.size());
        }

        SeriesContext context = SeriesContext.of(metric, service, series);
        List<AnomalyMethod> engaged = methods.stream()
                .filter(m -> config.isMethodEnabled(m.method()))
                .filter(m -> context.size() >= m.minimumSamples())
                .toList();

        List<CompletableFuture<List<DetectedAnomalyDto>>> futures = engaged.stream()
                .map(m -> CompletableFuture.supplyAsync(() -> runSafely(m, context), executor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<DetectedAnomalyDto> candidates = new ArrayList<>();
        futures.forEach(f -> candidates.addAll(f.join()));

        List<DetectedAnomalyDto> unique = deduplicate(candidates);
        log.info("{} service={}: {} points, {} candidates, {} unique anomalies", metric.metricName(), service,
                context.size(), candidates.size(), unique.size());
        return DetectionResult.of(metric, service, context.size(), unique);
    }

    /**
     * Keeps, per {@code (detectedAt, metricName)}, the candidate with the highest
     * {@code (severity rank, score)}; on a full tie the earliest candidate wins. Result is sorted
     * most recent first.
     */
    static List<DetectedAnomalyDto> deduplicate(List<DetectedAnomalyDto> candidates) {
        Map<String, DetectedAnomalyDto> best = new LinkedHashMap<>();
        for (DetectedAnomalyDto candidate : candidates) {
            best.merge(candidate.getDetectedAt() + "_" + candidate.getMetricName(), candidate,
                    (current, other) -> RANKING.compare(other, current) > 0 ? other : current);
        }
        return best.values().stream()
                .sorted(MOST_RECENT_FIRST)
                .toList();
    }

    private List<DetectedAnomalyDto> runSafely(AnomalyMethod method, SeriesContext context) {
        try {
            List<DetectedAnomalyDto> found = method.detect(context);
            log.info("{} found {} anomalies in {}", method.method().methodName(), found.size(), context.metricName());
            return found;
        } catch (RuntimeException e) {
            log.error("Error in {} detection on {}: {}", method.method().methodName(), context.metricName(),
                    e.getMessage(), e);
            return List.of();
        }
    }
}
