package com.cx.anomaly.engine.ensemble;

/**
 * One model's raw scores and flags for a batch, aligned by row.
 */
public record ModelScores(String model, double[] scores, boolean[] flags) {

    public ModelScores {
        if (scores.length != flags.length) {
            throw new IllegalArgumentException("scores and flags differ in length for " + model);
        }
    }

    public int size() {
        return scores.length;
    }

    public int anomalyCount() {
        int count = 0;
        for (boolean flag : flags) {
            if (flag) count++;
        }
        return count;
    }
}
