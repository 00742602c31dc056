package com.logflow.anomaly.source;

import com.logflow.anomaly.dto.TimeBucket;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Helpers turning sparse store buckets into the contiguous series the detectors expect. */
public final class TimeSeriesBuckets {

    private TimeSeriesBuckets() {
    }

    /**
     * Builds one bucket per {@code width} interval from the aligned start of {@code from} up to
     * {@code to}. Intervals missing from {@code observed} get a zero count; observed keys outside
     * the range are dropped.
     */
    public static List<TimeBucket> fill(Map<Instant, Double> observed, Instant from, Instant to, Duration width) {
        long widthMillis = width.toMillis();
        if (widthMillis <= 0) {
            throw new IllegalArgumentException("bucket width must be positive, was " + width);
        }
        List<TimeBucket> buckets = new ArrayList<>();
        if (to.isBefore(from)) {
            return buckets;
        }
        Instant cursor = align(from, widthMillis);
        while (!cursor.isAfter(to)) {
            buckets.add(new TimeBucket(cursor, observed.getOrDefault(cursor, 0.0)));
            cursor = cursor.plusMillis(widthMillis);
        }
        return buckets;
    }

    /** Error percentage of a bucket, 0 when the bucket holds no events. */
    public static double errorRate(long errors, long total) {
        return total > 0 ? (double) errors / total * 100.0 : 0.0;
    }

    static Instant align(Instant instant, long widthMillis) {
        long millis = instant.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(millis, widthMillis) * widthMillis);
    }
}
