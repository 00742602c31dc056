package com.logflow.anomaly.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class AnomalyReportDto {
    private String periodStart;
    private String periodEnd;
    private int windowMinutes;
    private String service;
    private int totalAnomalies;
    private List<DetectedAnomalyDto> anomalies;
    private Map<String, Long> anomaliesBySeverity;
    private Map<String, Long> anomaliesByService;

    /** True when none of the tracked metrics had enough buckets to run detection. */
    private boolean insufficientData;
    private List<String> metricsWithInsufficientData;
}
