package com.cx.anomaly.engine.threshold;

/**
 * Summary of a model's training-score distribution. {@code std} is the population deviation.
 */
public record ScoreStats(double min, double max, double mean, double std) {

    public static ScoreStats of(double[] scores) {
        if (scores.length == 0) {
            throw new IllegalArgumentException("Cannot summarize an empty score array");
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        for (double s : scores) {
            if (s < min) min = s;
            if (s > max) max = s;
            sum += s;
        }
        double mean = sum / scores.length;
        double sumSq = 0.0;
        for (double s : scores) {
            sumSq += (s - mean) * (s - mean);
        }
        return new ScoreStats(min, max, mean, Math.sqrt(sumSq / scores.length));
    }
}
