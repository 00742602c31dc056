package com.logflow.anomaly.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionMethod {
    ZSCORE("zscore"),
    MOVING_AVERAGE("moving_average"),
    ISOLATION_FOREST("isolation_forest");

    private final String methodName;

    DetectionMethod(String methodName) {
        this.methodName = methodName;
    }

    @JsonValue
    public String methodName() {
        return methodName;
    }
}
