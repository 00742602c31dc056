package com.logflow.anomaly;

import com.logflow.anomaly.dto.TimeBucket;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class TestSeries {

    public static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private TestSeries() {
    }

    /** One-minute buckets starting at {@link #START}. */
    public static List<TimeBucket> minutes(double... values) {
        List<TimeBucket> buckets = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            buckets.add(new TimeBucket(START.plusSeconds(60L * i), values[i]));
        }
        return buckets;
    }

    public static String minute(int index) {
        return START.plusSeconds(60L * index).toString();
    }

    public static double[] repeat(double value, int times, double... tail) {
        double[] values = new double[times + tail.length];
        for (int i = 0; i < times; i++) {
            values[i] = value;
        }
        System.arraycopy(tail, 0, values, times, tail.length);
        return values;
    }
}
