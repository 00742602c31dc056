package com.logflow.anomaly.services;

import com.logflow.anomaly.detectors.SeriesStatistics;
import com.logflow.anomaly.dto.BaselineStatsDto;
import com.logflow.anomaly.dto.MetricType;
import com.logflow.anomaly.dto.TimeBucket;
import com.logflow.anomaly.source.TimeSeriesSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Long-horizon statistics of a metric over hourly buckets, used to judge what normal looks like
 * for a service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineService {

    static final int BASELINE_BUCKET_MINUTES = 60;
    public static final int MAX_LOOKBACK_HOURS = 24 * 30;

    private final TimeSeriesSource timeSeriesSource;
    private final Clock clock;

    public BaselineStatsDto calculateBaseline(MetricType metric, String service, int lookbackHours) {
        if (lookbackHours < 1 || lookbackHours > MAX_LOOKBACK_HOURS) {
            throw new IllegalArgumentException("lookback_hours must be within [1, " + MAX_LOOKBACK_HOURS
                    + "], was " + lookbackHours);
        }
        List<TimeBucket> series = timeSeriesSource.queryBucketedCounts(metric, service, lookbackHours * 60,
                BASELINE_BUCKET_MINUTES);
        double[] values = series.stream().mapToDouble(TimeBucket::getCount).toArray();

        BaselineStatsDto.BaselineStatsDtoBuilder baseline = BaselineStatsDto.builder()
                .metricName(metric.metricName())
                .service(service)
                .sampleCount(values.length)
                .lastUpdated(clock.instant().toString());
        if (values.length == 0) {
            return baseline.build();
        }

        double min = values[0];
        double max = values[0];
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        log.debug("Baseline for {} service={}: {} hourly buckets", metric.metricName(), service, values.length);
        return baseline
                .mean(SeriesStatistics.mean(values))
                .stdDev(SeriesStatistics.stdDev(values))
                .minValue(min)
                .maxValue(max)
                .build();
    }
}
