package com.logflow.anomaly.services;

import com.logflow.anomaly.dto.AnomalyReportDto;
import com.logflow.anomaly.dto.DetectedAnomalyDto;
import com.logflow.anomaly.dto.MetricType;
import com.logflow.anomaly.dto.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Combines the verdicts of every tracked metric into one report with counts per severity and
 * per service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyReportService {

    /** Service bucket for anomalies detected without a service filter. */
    static final String ALL_SERVICES = "all";

    private static final List<MetricType> TRACKED_METRICS = List.of(MetricType.LOG_VOLUME, MetricType.ERROR_RATE);

    private final AnomalyDetectionService detectionService;
    private final Clock clock;

    public AnomalyReportDto buildReport(String service, int windowMinutes) {
        AnomalyDetectionService.validateWindow(windowMinutes);
        Instant periodEnd = clock.instant();
        Instant periodStart = periodEnd.minus(Duration.ofMinutes(windowMinutes));

        List<DetectionResult> results = detectionService.withinDeadline(() -> {
            List<DetectionResult> perMetric = new ArrayList<>();
            for (MetricType metric : TRACKED_METRICS) {
                perMetric.add(detectionService.detectUnbounded(metric, service, windowMinutes));
            }
            return perMetric;
        }, "anomaly report");

        AnomalyReportDto report = assemble(results, service, windowMinutes, periodStart, periodEnd);
        log.info("Anomaly report service={} window={}m: {} anomalies, insufficientData={}", service, windowMinutes,
                report.getTotalAnomalies(), report.isInsufficientData());
        return report;
    }

    static AnomalyReportDto assemble(List<DetectionResult> results, String service, int windowMinutes,
                                     Instant periodStart, Instant periodEnd) {
        List<DetectedAnomalyDto> anomalies = results.stream()
                .flatMap(r -> r.getAnomalies().stream())
                .sorted(AnomalyAggregator.MOST_RECENT_FIRST)
                .toList();

        Map<String, Long> bySeverity = new LinkedHashMap<>();
        List.of(Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.LOW)
                .forEach(s -> bySeverity.put(s.value(), 0L));
        Map<String, Long> byService = new TreeMap<>();
        for (DetectedAnomalyDto anomaly : anomalies) {
            bySeverity.merge(anomaly.getSeverity().value(), 1L, Long::sum);
            String key = anomaly.getService() == null ? ALL_SERVICES : anomaly.getService();
            byService.merge(key, 1L, Long::sum);
        }

        List<String> insufficient = results.stream()
                .filter(DetectionResult::isInsufficientData)
                .map(r -> r.getMetric().metricName())
                .toList();

        return AnomalyReportDto.builder()
                .periodStart(periodStart.toString())
                .periodEnd(periodEnd.toString())
                .windowMinutes(windowMinutes)
                .service(service)
                .totalAnomalies(anomalies.size())
                .anomalies(anomalies)
                .anomaliesBySeverity(bySeverity)
                .anomaliesByService(byService)
                .insufficientData(!results.isEmpty() && insufficient.size() == results.size())
                .metricsWithInsufficientData(insufficient)
                .build();
    }
}
