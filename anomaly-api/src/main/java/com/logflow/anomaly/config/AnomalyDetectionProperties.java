package com.logflow.anomaly.config;

import com.logflow.anomaly.dto.DetectionMethod;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

@Data
@Validated
@ConfigurationProperties(prefix = "anomaly.detection")
public class AnomalyDetectionProperties {

    /** Master switch; when false every detection call returns no anomalies. */
    private boolean enabled = true;

    /** Minimum number of buckets before any method runs. Kept low because per-minute series are sparse. */
    @Min(1) private int minSamples = 5;

    /** Deviation threshold in standard deviations. Lower favours recall. */
    @DecimalMin(value = "0.0", inclusive = false) private double sensitivity = 1.0;

    /** Default window when the caller does not pass window_minutes. */
    @Min(10) @Max(1440) private int detectionWindowMinutes = 60;

    /** Methods to run: zscore, moving_average, isolation_forest. */
    @NotNull private Set<DetectionMethod> methods = EnumSet.allOf(DetectionMethod.class);

    /** Trailing window of the moving average method; shrunk to n/3 for short series. */
    @Min(1) private int movingAverageWindow = 5;

    /** Isolation forest is only engaged on series at least this long. */
    @Min(2) private int isolationForestMinSamples = 20;

    /** Expected outlier share for the isolation forest. */
    @DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "0.5", inclusive = false)
    private double contamination = 0.1;

    @Min(1) private int isolationForestTrees = 100;

    @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0")
    private double isolationForestSubsample = 0.7;

    /** Seed for the isolation forest RNG, fixed so repeated requests give the same verdicts. */
    private long randomSeed = 42L;

    /** Width of a series bucket. */
    @Min(1) private int bucketWidthMinutes = 1;

    /** Upper bound on one detection or report request. */
    @NotNull private Duration requestTimeout = Duration.ofSeconds(30);

    private Executor executor = new Executor();

    public DetectorConfig toDetectorConfig() {
        return DetectorConfig.builder()
                .enabled(enabled)
                .minSamples(minSamples)
                .sensitivity(sensitivity)
                .detectionWindowMinutes(detectionWindowMinutes)
                .enabledMethods(methods)
                .movingAverageWindow(movingAverageWindow)
                .isolationForestMinSamples(isolationForestMinSamples)
                .contamination(contamination)
                .isolationForestTrees(isolationForestTrees)
                .isolationForestSubsample(isolationForestSubsample)
                .randomSeed(randomSeed)
                .bucketWidthMinutes(bucketWidthMinutes)
                .requestTimeout(requestTimeout)
                .build();
    }

    @Data
    public static class Executor {
        /** Threads running the detection methods of a request in parallel. */
        @Min(1) private int detectorThreads = 3;

        /** Threads running whole requests under the request timeout. */
        @Min(1) private int requestThreads = 8;

        @Min(0) private int queueCapacity = 100;
    }
}
