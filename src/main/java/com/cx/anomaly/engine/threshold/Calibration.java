package com.cx.anomaly.engine.threshold;

public record Calibration(double threshold, double percentile, ScoreStats stats) {

    /** A single model flags a record iff its score is at or above the threshold. */
    public boolean isAnomaly(double score) {
        return score >= threshold;
    }
}
