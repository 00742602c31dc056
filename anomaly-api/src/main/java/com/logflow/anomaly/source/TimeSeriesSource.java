package com.logflow.anomaly.source;

import com.logflow.anomaly.dto.MetricType;
import com.logflow.anomaly.dto.TimeBucket;

import java.util.List;

/**
 * Produces the bucketed series a detection runs on.
 */
public interface TimeSeriesSource {

    /**
     * Returns buckets of {@code bucketWidthMinutes} covering {@code [now - windowMinutes, now]},
     * ascending and contiguous: intervals without events are present with a zero count.
     *
     * @param metric             log volume (event count) or error rate (error percentage)
     * @param service            optional service filter, {@code null} for all services
     * @param windowMinutes      length of the window ending now
     * @param bucketWidthMinutes bucket width
     * @throws com.logflow.anomaly.exceptions.LogStoreUnavailableException if the store cannot be queried
     */
    List<TimeBucket> queryBucketedCounts(MetricType metric, String service, int windowMinutes, int bucketWidthMinutes);
}
