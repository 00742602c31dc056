package com.logflow.anomaly.detectors;

import com.logflow.anomaly.config.DetectorConfig;
import com.logflow.anomaly.dto.AnomalyType;
import com.logflow.anomaly.dto.DetectedAnomalyDto;
import com.logflow.anomaly.dto.DetectionMethod;
import com.logflow.anomaly.dto.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * Ensemble outlier scorer over the raw value distribution. Makes no normality assumption, so it
 * also catches multi-modal patterns the deviation based methods miss.
 * <p>
 * A fresh forest is fitted per series. Points whose isolation score lies strictly above the
 * {@code 1 - contamination} quantile of all scores are reported.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IsolationForestDetector implements AnomalyMethod {

    private final DetectorConfig config;

    @Override
    public DetectionMethod method() {
        return DetectionMethod.ISOLATION_FOREST;
    }

    @Override
    public int minimumSamples() {
        return config.getIsolationForestMinSamples();
    }

    @Override
    public List<DetectedAnomalyDto> detect(SeriesContext series) {
        double[] values = series.getValues();
        if (values.length < minimumSamples()) {
            return List.of();
        }

        double[][] data = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            data[i] = new double[]{values[i]};
        }

        double[] scores = fitAndScore(data);
        double threshold = SeriesStatistics.quantile(scores, 1.0 - config.getContamination());
        double mean = SeriesStatistics.mean(values);
        log.debug("Isolation forest: {} points, score threshold={}", values.length, threshold);

        List<DetectedAnomalyDto> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (scores[i] <= threshold) {
                continue;
            }
            double actual = values[i];
            double score = Math.abs(scores[i]);
            anomalies.add(DetectedAnomalyDto.builder()
                    .detectedAt(series.getTimestamps()[i])
                    .metricName(series.metricName())
                    .service(series.getService())
                    .anomalyType(typeOf(actual, mean))
                    .description(String.format(Locale.ROOT, "%s IF anomaly: %.2f (mean %.2f)",
                            series.metricName(), actual, mean))
                    .score(score)
                    .severity(severityOf(score))
                    .actualValue(actual)
                    .expectedValue(mean)
                    .deviationPercent(SeriesStatistics.deviationPercent(actual, mean))
                    .method(method())
                    .build());
        }
        return anomalies;
    }

    /**
     * Fits the forest and scores every row. Smile builds trees in a parallel stream and draws from
     * a per-thread generator, so the fit runs inside a single-thread fork/join pool whose only
     * worker is reseeded first. Every random draw then comes from one seeded generator in a fixed
     * order.
     */
    private double[] fitAndScore(double[][] data) {
        int sampleSize = Math.max(2, (int) Math.round(config.getIsolationForestSubsample() * data.length));
        int maxDepth = Math.max(1, (int) Math.ceil(Math.log(sampleSize) / Math.log(2)));

        ForkJoinPool pool = new ForkJoinPool(1, ForkJoinPool.defaultForkJoinWorkerThreadFactory, null, false,
                1, 1, 1, p -> true, 30, TimeUnit.SECONDS);
        try {
            return pool.submit(() -> {
                MathEx.setSeed(config.getRandomSeed());
                IsolationForest forest = IsolationForest.fit(data, config.getIsolationForestTrees(), maxDepth,
                        config.getIsolationForestSubsample(), 0);
                return forest.score(data);
            }).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Isolation forest fit was interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Isolation forest fit failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    static AnomalyType typeOf(double actual, double mean) {
        if (actual > mean * 1.5) return AnomalyType.SPIKE;
        if (actual < mean * 0.5) return AnomalyType.DROP;
        return AnomalyType.PATTERN_CHANGE;
    }

    static Severity severityOf(double score) {
        if (score > 0.6) return Severity.CRITICAL;
        if (score > 0.5) return Severity.HIGH;
        if (score > 0.4) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
