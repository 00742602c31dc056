package com.logflow.anomaly.detectors;

import com.logflow.anomaly.config.DetectorConfig;
import com.logflow.anomaly.dto.DetectedAnomalyDto;
import com.logflow.anomaly.dto.DetectionMethod;

import java.util.List;

/**
 * One anomaly scoring method over a metric series. Implementations are stateless; all tuning
 * comes from the {@link DetectorConfig} they are built with.
 */
public interface AnomalyMethod {

    DetectionMethod method();

    /** Shortest series this method can score. The aggregator skips the method below it. */
    int minimumSamples();

    /**
     * Scores the series and returns the points considered anomalous, in series order.
     * Degenerate input (flat or too short) yields an empty list, never an exception.
     */
    List<DetectedAnomalyDto> detect(SeriesContext series);
}
