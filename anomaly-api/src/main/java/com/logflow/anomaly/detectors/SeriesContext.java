package com.logflow.anomaly.detectors;

import com.logflow.anomaly.dto.MetricType;
import com.logflow.anomaly.dto.TimeBucket;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * A metric series prepared for the detectors: parallel arrays of ISO-8601 timestamps and values.
 * Detectors only read from it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SeriesContext {
    MetricType metric;
    String service;
    String[] timestamps;
    double[] values;

    public static SeriesContext of(MetricType metric, String service, List<TimeBucket> buckets) {
        String[] timestamps = new String[buckets.size()];
        double[] values = new double[buckets.size()];
        for (int i = 0; i < buckets.size(); i++) {
            timestamps[i] = buckets.get(i).getTimestamp().toString();
            values[i] = buckets.get(i).getCount();
        }
        return new SeriesContext(metric, service, timestamps, values);
    }

    public int size() {
        return values.length;
    }

    public String metricName() {
        return metric.metricName();
    }
}
