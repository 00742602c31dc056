package com.logflow.anomaly.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DetectedAnomalyDto {
    private String detectedAt;
    private String metricName;
    private String service;
    private AnomalyType anomalyType;
    private String description;
    private double score;
    private Severity severity;
    private double actualValue;
    private double expectedValue;
    private double deviationPercent;
    private DetectionMethod method;
}
