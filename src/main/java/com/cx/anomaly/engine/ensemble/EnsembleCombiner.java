package com.cx.anomaly.engine.ensemble;

import com.cx.anomaly.engine.threshold.ScoreStats;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fuses per-model scores into one ensemble score and flag.
 *
 * Each model's score is min-max normalized against that model's training range and clipped to
 * [0, 1], then weighted and summed. The ensemble flag is the OR of the model flags, not a
 * threshold on the fused score.
 */
public class EnsembleCombiner {

    public static final double EPSILON = 1e-10;

    public List<EnsembleResult> combine(Map<String, ModelScores> scoresByModel,
                                        Map<String, ScoreStats> statsByModel,
                                        Map<String, Double> weights) {
        if (scoresByModel.isEmpty()) {
            return List.of();
        }
        int size = -1;
        for (ModelScores modelScores : scoresByModel.values()) {
            if (size >= 0 && modelScores.size() != size) {
                throw new IllegalArgumentException("Model score arrays differ in length");
            }
            size = modelScores.size();
        }

        double defaultWeight = 1.0 / scoresByModel.size();
        double[] fused = new double[size];
        boolean[] flagged = new boolean[size];
        for (Map.Entry<String, ModelScores> entry : scoresByModel.entrySet()) {
            String model = entry.getKey();
            ScoreStats stats = statsByModel.get(model);
            if (stats == null) {
                throw new IllegalArgumentException("No training score statistics for model " + model);
            }
            double weight = weights.getOrDefault(model, defaultWeight);
            ModelScores modelScores = entry.getValue();
            for (int i = 0; i < size; i++) {
                fused[i] += weight * normalize(modelScores.scores()[i], stats);
                flagged[i] |= modelScores.flags()[i];
            }
        }

        List<EnsembleResult> results = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            results.add(new EnsembleResult(fused[i], flagged[i]));
        }
        return results;
    }

    /**
     * Min-max normalization against the training range, clipped to [0, 1].
     */
    public static double normalize(double score, ScoreStats stats) {
        double normalized = (score - stats.min()) / (stats.max() - stats.min() + EPSILON);
        return Math.min(1.0, Math.max(0.0, normalized));
    }
}
