package com.cx.anomaly.registry;

import com.cx.anomaly.engine.ensemble.EnsembleResult;
import com.cx.anomaly.engine.ensemble.ModelScores;

import java.util.List;
import java.util.Map;

/**
 * Scores for one table, all computed against the snapshot identified by {@code snapshotVersion}.
 * {@code ensemble} is empty when fewer than two models were scored.
 */
public record ScoringBatch(long snapshotVersion,
                           List<String> interactionIds,
                           Map<String, ModelScores> modelScores,
                           List<EnsembleResult> ensemble) {

    public int size() {
        return interactionIds.size();
    }

    public boolean hasEnsemble() {
        return !ensemble.isEmpty();
    }

    /**
     * Ensemble flag when present, otherwise whether any scored model flagged the row.
     */
    public boolean isAnomaly(int row) {
        if (hasEnsemble()) {
            return ensemble.get(row).anomaly();
        }
        for (ModelScores scores : modelScores.values()) {
            if (scores.flags()[row]) return true;
        }
        return false;
    }

    public int anomalyCount() {
        int count = 0;
        for (int i = 0; i < size(); i++) {
            if (isAnomaly(i)) count++;
        }
        return count;
    }
}
