package com.cx.anomaly.engine.threshold;

import java.util.Arrays;

/**
 * Derives a model's decision threshold from its own training-score distribution.
 */
public class ThresholdCalibrator {

    public Calibration calibrate(double[] trainScores, double percentile) {
        return new Calibration(percentile(trainScores, percentile), percentile, ScoreStats.of(trainScores));
    }

    /**
     * Value at {@code percentile} (0-100), linearly interpolated between order statistics
     * at rank {@code p / 100 * (n - 1)}.
     */
    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot take a percentile of an empty array");
        }
        if (Double.isNaN(percentile) || percentile < 0.0 || percentile > 100.0) {
            throw new IllegalArgumentException("Percentile must be within [0, 100], got " + percentile);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }
}
