package com.logflow.anomaly.detectors;

import java.util.Arrays;

/** Population statistics over (ranges of) a value series. */
public final class SeriesStatistics {

    private SeriesStatistics() {
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /** Mean of {@code values[from, to)}; 0 for an empty range. */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    public static double stdDev(double[] values) {
        return stdDev(values, 0, values.length);
    }

    /** Population standard deviation of {@code values[from, to)}; 0 for an empty range. */
    public static double stdDev(double[] values, int from, int to) {
        if (to <= from) {
            return 0.0;
        }
        double mean = mean(values, from, to);
        double sumSq = 0.0;
        for (int i = from; i < to; i++) {
            double d = values[i] - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (to - from));
    }

    /**
     * Linear-interpolated quantile ({@code q} in [0, 1]) of the values, the same interpolation
     * numpy's default percentile uses.
     */
    public static double quantile(double[] values, double q) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        return sorted[lower] + (pos - lower) * (sorted[upper] - sorted[lower]);
    }

    /** {@code (actual - expected) / expected * 100}, or 0 when expected is 0 or the result is not finite. */
    public static double deviationPercent(double actual, double expected) {
        if (expected == 0.0) {
            return 0.0;
        }
        double pct = (actual - expected) / expected * 100.0;
        return Double.isFinite(pct) ? pct : 0.0;
    }
}
