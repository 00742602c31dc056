package com.logflow.anomaly.source;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.aggregations.Aggregate;
import co.elastic.clients.elasticsearch._types.aggregations.Aggregation;
import co.elastic.clients.elasticsearch._types.aggregations.DateHistogramBucket;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.RangeQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.TermQuery;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.json.JsonData;
import com.logflow.anomaly.dto.MetricType;
import com.logflow.anomaly.dto.TimeBucket;
import com.logflow.anomaly.exceptions.LogStoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link TimeSeriesSource} backed by the log indices: one {@code date_histogram} aggregation per
 * call, with an {@code errors} filter sub-aggregation for the error rate.
 */
@Slf4j
@Service
public class ElasticsearchTimeSeriesSource implements TimeSeriesSource {

    static final String TIME_BUCKETS = "time_buckets";
    static final String ERRORS = "errors";

    private static final String TIMESTAMP_FIELD = "timestamp";
    private static final String SERVICE_FIELD = "service.keyword";
    private static final String LEVEL_FIELD = "level";
    private static final List<FieldValue> ERROR_LEVELS = List.of(FieldValue.of("ERROR"), FieldValue.of("CRITICAL"));

    private final ElasticsearchClient client;
    private final Clock clock;
    private final String indexPattern;

    public ElasticsearchTimeSeriesSource(ElasticsearchClient client, Clock clock,
                                         @Value("${logflow.elasticsearch.index-pattern:logs-*}") String indexPattern) {
        this.client = client;
        this.clock = clock;
        this.indexPattern = indexPattern;
    }

    @Override
    public List<TimeBucket> queryBucketedCounts(MetricType metric, String service, int windowMinutes, int bucketWidthMinutes) {
        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofMinutes(windowMinutes));

        SearchRequest request = SearchRequest.of(s -> s
                .index(indexPattern)
                .size(0)
                .query(query(service, start, end))
                .aggregations(TIME_BUCKETS, histogram(metric, bucketWidthMinutes)));

        SearchResponse<Void> response;
        try {
            response = client.search(request, Void.class);
        } catch (IOException | ElasticsearchException e) {
            log.error("Error getting {} time series from {}: {}", metric.metricName(), indexPattern, e.getMessage());
            throw new LogStoreUnavailableException("Log store unavailable while reading " + metric.metricName(), e);
        }

        Map<Instant, Double> observed = new HashMap<>();
        Aggregate aggregate = response.aggregations().get(TIME_BUCKETS);
        if (aggregate != null) {
            for (DateHistogramBucket bucket : aggregate.dateHistogram().buckets().array()) {
                observed.put(Instant.ofEpochMilli(bucket.key()), valueOf(metric, bucket));
            }
        }
        List<TimeBucket> series = TimeSeriesBuckets.fill(observed, start, end, Duration.ofMinutes(bucketWidthMinutes));
        log.debug("Read {} {} buckets ({} non-empty) for service={}", series.size(), metric.metricName(),
                observed.size(), service);
        return series;
    }

    private static double valueOf(MetricType metric, DateHistogramBucket bucket) {
        if (metric == MetricType.ERROR_RATE) {
            Aggregate errors = bucket.aggregations().get(ERRORS);
            long errorCount = errors == null ? 0L : errors.filter().docCount();
            return TimeSeriesBuckets.errorRate(errorCount, bucket.docCount());
        }
        return (double) bucket.docCount();
    }

    private static Query query(String service, Instant start, Instant end) {
        Query range = RangeQuery.of(r -> r
                .field(TIMESTAMP_FIELD)
                .gte(JsonData.of(start.toString()))
                .lte(JsonData.of(end.toString())))._toQuery();
        if (!StringUtils.hasText(service)) {
            return range;
        }
        Query term = TermQuery.of(t -> t.field(SERVICE_FIELD).value(service))._toQuery();
        return BoolQuery.of(b -> b.must(range).must(term))._toQuery();
    }

    private static Aggregation histogram(MetricType metric, int bucketWidthMinutes) {
        return Aggregation.of(a -> {
            var container = a.dateHistogram(h -> h
                    .field(TIMESTAMP_FIELD)
                    .fixedInterval(t -> t.time(bucketWidthMinutes + "m"))
                    .minDocCount(0));
            if (metric == MetricType.ERROR_RATE) {
                container.aggregations(ERRORS, e -> e.filter(f -> f.terms(t -> t
                        .field(LEVEL_FIELD)
                        .terms(v -> v.value(ERROR_LEVELS)))));
            }
            return container;
        });
    }
}
