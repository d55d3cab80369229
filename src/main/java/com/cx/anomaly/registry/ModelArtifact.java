package com.cx.anomaly.registry;

import com.cx.anomaly.engine.AnomalyDetector;
import com.cx.anomaly.engine.ensemble.ModelScores;
import com.cx.anomaly.model.ModelMetadata;

/**
 * A fitted detector together with its calibrated threshold and training metadata.
 */
public record ModelArtifact(String name, AnomalyDetector detector, ModelMetadata metadata) {

    public double threshold() {
        return metadata.getThreshold();
    }

    public boolean isAnomaly(double score) {
        return score >= metadata.getThreshold();
    }

    public ModelScores score(double[][] features) {
        double[] scores = detector.scoreSamples(features);
        boolean[] flags = new boolean[scores.length];
        for (int i = 0; i < scores.length; i++) {
            flags[i] = isAnomaly(scores[i]);
        }
        return new ModelScores(name, scores, flags);
    }
}
