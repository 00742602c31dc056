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
 * Local-statistics scorer: compares each point with the trailing mean of the preceding
 * {@code window} points, scaled by the spread of the look-back span including the point itself.
 * Adapts to trend, so it flags points that are unusual for recent behaviour.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MovingAverageDetector implements AnomalyMethod {

    private final DetectorConfig config;

    @Override
    public DetectionMethod method() {
        return DetectionMethod.MOVING_AVERAGE;
    }

    @Override
    public int minimumSamples() {
        // a window of at least 1 needs n / 3 >= 1
        return 3;
    }

    /** Configured window, shrunk to n / 3 so short series still produce a result. */
    int effectiveWindow(int size) {
        return Math.min(config.getMovingAverageWindow(), size / 3);
    }

    @Override
    public List<DetectedAnomalyDto> detect(SeriesContext series) {
        double[] values = series.getValues();
        int window = effectiveWindow(values.length);
        if (window < 1 || values.length <= window) {
            return List.of();
        }

        List<DetectedAnomalyDto> anomalies = new ArrayList<>();
        for (int i = window; i < values.length; i++) {
            double movingAvg = SeriesStatistics.mean(values, i - window, i);
            double movingStd = SeriesStatistics.stdDev(values, i - window, i + 1);
            if (movingStd == 0.0) {
                continue;
            }
            double actual = values[i];
            double deviation = Math.abs(actual - movingAvg);
            if (deviation <= config.getSensitivity() * movingStd) {
                continue;
            }
            double z = deviation / movingStd;
            AnomalyType type = actual > movingAvg ? AnomalyType.SPIKE : AnomalyType.DROP;
            anomalies.add(DetectedAnomalyDto.builder()
                    .detectedAt(series.getTimestamps()[i])
                    .metricName(series.metricName())
                    .service(series.getService())
                    .anomalyType(type)
                    .description(String.format(Locale.ROOT, "%s MA %s: %.2f (moving average %.2f)",
                            series.metricName(), type.value(), actual, movingAvg))
                    .score(z)
                    .severity(z > 3 ? Severity.HIGH : Severity.MEDIUM)
                    .actualValue(actual)
                    .expectedValue(movingAvg)
                    .deviationPercent(SeriesStatistics.deviationPercent(actual, movingAvg))
                    .method(method())
                    .build());
        }
        log.debug("Moving average (window={}) flagged {} of {} points", window, anomalies.size(), values.length);
        return anomalies;
    }
}
