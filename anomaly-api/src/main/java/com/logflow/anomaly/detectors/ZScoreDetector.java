package com.logflow.anomaly.detectors;

import com.logflow.anomaly.config.DetectorConfig;
import com.logflow.anomaly.dto.AnomalyType;
import com.logflow.anomaly.dto.DetectedAnomalyDto;
import com.logflow.anomaly.dto.DetectionMethod;
import com.logflow.anomaly.dto.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Global-statistics scorer: treats the whole window as one distribution and flags points whose
 * distance from the mean exceeds {@code sensitivity} standard deviations. Catches isolated
 * outliers, blind to slow trend shifts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ZScoreDetector implements AnomalyMethod {

    private final DetectorConfig config;

    @Override
    public DetectionMethod method() {
        return DetectionMethod.ZSCORE;
    }

    @Override
    public int minimumSamples() {
        return 2;
    }

    @Override
    public List<DetectedAnomalyDto> detect(SeriesContext series) {
        double[] values = series.getValues();
        if (values.length == 0) {
            return List.of();
        }
        double mean = SeriesStatistics.mean(values);
        double std = SeriesStatistics.stdDev(values);
        log.debug("Z-Score: mean={}, std={}", mean, std);

        if (std == 0.0) {
            log.debug("Standard deviation is 0, no anomalies");
            return List.of();
        }

        double threshold = config.getSensitivity();
        List<DetectedAnomalyDto> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double actual = values[i];
            double z = Math.abs(actual - mean) / std;
            if (z <= threshold) {
                continue;
            }
            AnomalyType type = actual > mean ? AnomalyType.SPIKE : AnomalyType.DROP;
            anomalies.add(DetectedAnomalyDto.builder()
                    .detectedAt(series.getTimestamps()[i])
                    .metricName(series.metricName())
                    .service(series.getService())
                    .anomalyType(type)
                    .description(String.format(Locale.ROOT, "%s %s: %.2f (expected ~%.2f)",
                            series.metricName(), type.value(), actual, mean))
                    .score(z)
                    .severity(severityOf(z))
                    .actualValue(actual)
                    .expectedValue(mean)
                    .deviationPercent(SeriesStatistics.deviationPercent(actual, mean))
                    .method(method())
                    .build());
            log.debug("Detected anomaly: {} at {}, z={}", type, series.getTimestamps()[i], z);
        }
        return anomalies;
    }

    static Severity severityOf(double z) {
        if (z > 4) return Severity.CRITICAL;
        if (z > 3) return Severity.HIGH;
        if (z > 1.5) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
