package com.logflow.anomaly.controller;

import com.logflow.anomaly.config.DetectorConfig;
import com.logflow.anomaly.dto.AnomalyReportDto;
import com.logflow.anomaly.dto.BaselineStatsDto;
import com.logflow.anomaly.dto.DetectedAnomalyDto;
import com.logflow.anomaly.dto.MetricType;
import com.logflow.anomaly.services.AnomalyDetectionService;
import com.logflow.anomaly.services.AnomalyReportService;
import com.logflow.anomaly.services.BaselineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/anomaly")
@RequiredArgsConstructor
public class AnomalyController {
    private final AnomalyDetectionService detectionService;
    private final AnomalyReportService reportService;
    private final BaselineService baselineService;
    private final DetectorConfig detectorConfig;

    @Operation(summary = "Detect anomalies in log volume (Z-score, moving average, isolation forest)")
    @GetMapping("/detect/log-volume")
    public List<DetectedAnomalyDto> detectLogVolumeAnomalies(
            @Parameter(description = "Service to analyze", example = "payment-service")
            @RequestParam(name = "service", required = false) String service,
            @Parameter(description = "Time window in minutes", example = "60")
            @RequestParam(name = "window_minutes", required = false) @Min(10) @Max(1440) Integer windowMinutes) {
        return detectionService.detectLogVolumeAnomalies(service, windowOrDefault(windowMinutes));
    }

    @Operation(summary = "Detect unusual spikes or drops in error percentage")
    @GetMapping("/detect/error-rate")
    public List<DetectedAnomalyDto> detectErrorRateAnomalies(
            @Parameter(description = "Service to analyze", example = "payment-service")
            @RequestParam(name = "service", required = false) String service,
            @Parameter(description = "Time window in minutes", example = "60")
            @RequestParam(name = "window_minutes", required = false) @Min(10) @Max(1440) Integer windowMinutes) {
        return detectionService.detectErrorRateAnomalies(service, windowOrDefault(windowMinutes));
    }

    @Operation(summary = "All detected anomalies with counts by severity and service")
    @GetMapping("/report")
    public AnomalyReportDto getAnomalyReport(
            @RequestParam(name = "service", required = false) String service,
            @RequestParam(name = "window_minutes", required = false) @Min(10) @Max(1440) Integer windowMinutes) {
        return reportService.buildReport(service, windowOrDefault(windowMinutes));
    }

    @Operation(summary = "Baseline statistics of a metric over hourly buckets")
    @GetMapping("/baseline")
    public BaselineStatsDto getBaseline(
            @Parameter(description = "log_volume or error_rate", example = "log_volume")
            @RequestParam(name = "metric", defaultValue = "log_volume") String metric,
            @RequestParam(name = "service", required = false) String service,
            @Parameter(description = "Look-back in hours", example = "168")
            @RequestParam(name = "lookback_hours", defaultValue = "168") @Min(1) @Max(720) int lookbackHours) {
        return baselineService.calculateBaseline(MetricType.fromName(metric), service, lookbackHours);
    }

    @Operation(summary = "Effective detector configuration")
    @GetMapping("/config")
    public DetectorConfig getConfig() {
        return detectorConfig;
    }

    private int windowOrDefault(Integer windowMinutes) {
        int window = windowMinutes == null ? detectorConfig.getDetectionWindowMinutes() : windowMinutes;
        AnomalyDetectionService.validateWindow(window);
        return window;
    }
}
