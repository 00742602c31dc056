package com.logflow.anomaly.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class BaselineStatsDto {
    private String metricName;
    private String service;
    private double mean;
    private double stdDev;
    private double minValue;
    private double maxValue;
    private int sampleCount;
    private String lastUpdated;
}
