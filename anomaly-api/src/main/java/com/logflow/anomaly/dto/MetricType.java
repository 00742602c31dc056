package com.logflow.anomaly.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum MetricType {
    LOG_VOLUME("log_volume"),
    ERROR_RATE("error_rate");

    private final String metricName;

    MetricType(String metricName) {
        this.metricName = metricName;
    }

    @JsonValue
    public String metricName() {
        return metricName;
    }

    /** Resolves "log_volume" / "error_rate" (or the enum name) to a metric. */
    public static MetricType fromName(String name) {
        return Arrays.stream(values())
                .filter(m -> m.metricName.equalsIgnoreCase(name) || m.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + name));
    }
}
