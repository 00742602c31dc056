package com.logflow.anomaly.dto;

import lombok.Value;

import java.time.Instant;

/**
 * One fixed-width interval of a metric series. For log volume {@code count} is the number of
 * events in the interval, for error rate it is the error percentage.
 */
@Value
public class TimeBucket {
    Instant timestamp;
    double count;
}
