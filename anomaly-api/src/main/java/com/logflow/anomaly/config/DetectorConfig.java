package com.logflow.anomaly.config;

import com.logflow.anomaly.dto.DetectionMethod;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable detector settings shared by every detection request. Instances are validated when
 * built, so an invalid configuration never reaches a detector.
 */
@Value
public class DetectorConfig {

    boolean enabled;

    /** Series shorter than this are reported as insufficient data; no detector runs. */
    int minSamples;

    /** Deviation threshold, in standard deviations, used by the Z-score and moving average methods. */
    double sensitivity;

    /** Window used when a caller does not pass one. */
    int detectionWindowMinutes;

    Set<DetectionMethod> enabledMethods;

    int movingAverageWindow;

    int isolationForestMinSamples;

    /** Expected share of outliers; the isolation score quantile above which points are flagged. */
    double contamination;

    int isolationForestTrees;

    double isolationForestSubsample;

    long randomSeed;

    int bucketWidthMinutes;

    Duration requestTimeout;

    @Builder(toBuilder = true)
    private DetectorConfig(boolean enabled, int minSamples, double sensitivity, int detectionWindowMinutes,
                           Set<DetectionMethod> enabledMethods, int movingAverageWindow,
                           int isolationForestMinSamples, double contamination, int isolationForestTrees,
                           double isolationForestSubsample, long randomSeed, int bucketWidthMinutes,
                           Duration requestTimeout) {
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1, was " + minSamples);
        }
        if (!(sensitivity > 0) || Double.isInfinite(sensitivity)) {
            throw new IllegalArgumentException("sensitivity must be a positive number, was " + sensitivity);
        }
        if (detectionWindowMinutes < 10 || detectionWindowMinutes > 1440) {
            throw new IllegalArgumentException("detectionWindowMinutes must be within [10, 1440], was "
                    + detectionWindowMinutes);
        }
        if (enabled && (enabledMethods == null || enabledMethods.isEmpty())) {
            throw new IllegalArgumentException("at least one detection method must be enabled");
        }
        if (movingAverageWindow < 1) {
            throw new IllegalArgumentException("movingAverageWindow must be >= 1, was " + movingAverageWindow);
        }
        if (isolationForestMinSamples < 2) {
            throw new IllegalArgumentException("isolationForestMinSamples must be >= 2, was "
                    + isolationForestMinSamples);
        }
        if (!(contamination > 0 && contamination < 0.5)) {
            throw new IllegalArgumentException("contamination must be within (0, 0.5), was " + contamination);
        }
        if (isolationForestTrees < 1) {
            throw new IllegalArgumentException("isolationForestTrees must be >= 1, was " + isolationForestTrees);
        }
        if (!(isolationForestSubsample > 0 && isolationForestSubsample <= 1)) {
            throw new IllegalArgumentException("isolationForestSubsample must be within (0, 1], was "
                    + isolationForestSubsample);
        }
        if (bucketWidthMinutes < 1) {
            throw new IllegalArgumentException("bucketWidthMinutes must be >= 1, was " + bucketWidthMinutes);
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive, was " + requestTimeout);
        }
        this.enabled = enabled;
        this.minSamples = minSamples;
        this.sensitivity = sensitivity;
        this.detectionWindowMinutes = detectionWindowMinutes;
        this.enabledMethods = enabledMethods == null || enabledMethods.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(enabledMethods));
        this.movingAverageWindow = movingAverageWindow;
        this.isolationForestMinSamples = isolationForestMinSamples;
        this.contamination = contamination;
        this.isolationForestTrees = isolationForestTrees;
        this.isolationForestSubsample = isolationForestSubsample;
        this.randomSeed = randomSeed;
        this.bucketWidthMinutes = bucketWidthMinutes;
        this.requestTimeout = requestTimeout;
    }

    /** Builder pre-filled with the defaults used for sparse per-minute log series. */
    public static DetectorConfigBuilder defaults() {
        return builder()
                .enabled(true)
                .minSamples(5)
                .sensitivity(1.0)
                .detectionWindowMinutes(60)
                .enabledMethods(EnumSet.allOf(DetectionMethod.class))
                .movingAverageWindow(5)
                .isolationForestMinSamples(20)
                .contamination(0.1)
                .isolationForestTrees(100)
                .isolationForestSubsample(0.7)
                .randomSeed(42L)
                .bucketWidthMinutes(1)
                .requestTimeout(Duration.ofSeconds(30));
    }

    public boolean isMethodEnabled(DetectionMethod method) {
        return enabledMethods.contains(method);
    }
}
