package com.logflow.anomaly.services;

import com.logflow.anomaly.dto.DetectedAnomalyDto;
import com.logflow.anomaly.dto.MetricType;
import lombok.Value;

import java.util.List;

/**
 * Outcome of detection over one metric series. {@code insufficientData} means the series was
 * too short to analyse, which is not the same as a clean series.
 */
@Value
public class DetectionResult {
    MetricType metric;
    String service;
    int points;
    boolean insufficientData;
    List<DetectedAnomalyDto> anomalies;

    public static DetectionResult of(MetricType metric, String service, int points, List<DetectedAnomalyDto> anomalies) {
        return new DetectionResult(metric, service, points, false, List.copyOf(anomalies));
    }

    public static DetectionResult insufficientData(MetricType metric, String service, int points) {
        return new DetectionResult(metric, service, points, true, List.of());
    }
}
