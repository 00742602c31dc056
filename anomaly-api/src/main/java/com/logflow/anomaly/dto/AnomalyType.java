package com.logflow.anomaly.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnomalyType {
    SPIKE,
    DROP,
    PATTERN_CHANGE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
