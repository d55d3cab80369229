package com.cx.anomaly.engine.ensemble;

import com.cx.anomaly.engine.threshold.ScoreStats;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EnsembleCombinerTest {

    private final EnsembleCombiner combiner = new EnsembleCombiner();

    private static Map<String, ScoreStats> stats(ScoreStats iforest, ScoreStats lof) {
        return Map.of("iforest", iforest, "lof", lof);
    }

    @Test
    void combine_randomScores_staysWithinUnitIntervalWhenWeightsSumToOne() {
        Random random = new Random(17L);
        for (int trial = 0; trial < 200; trial++) {
            int n = 1 + random.nextInt(50);
            double[] a = new double[n];
            double[] b = new double[n];
            for (int i = 0; i < n; i++) {
                // includes values outside the training range, so clipping is exercised
                a[i] = random.nextDouble() * 3 - 1;
                b[i] = random.nextGaussian() * 5;
            }
            double w = random.nextDouble();
            Map<String, ModelScores> scores = new LinkedHashMap<>();
            scores.put("iforest", new ModelScores("iforest", a, new boolean[n]));
            scores.put("lof", new ModelScores("lof", b, new boolean[n]));

            List<EnsembleResult> results = combiner.combine(scores,
                    stats(new ScoreStats(0.0, 1.0, 0.5, 0.1), new ScoreStats(-2.0, 2.0, 0.0, 1.0)),
                    Map.of("iforest", w, "lof", 1.0 - w));

            assertThat(results).hasSize(n);
            for (EnsembleResult result : results) {
                assertThat(result.score()).isBetween(0.0, 1.0 + 1e-12);
            }
        }
    }

    @Test
    void combine_flagIsOrOfModelFlags_forAllCombinations() {
        boolean[] iforestFlags = {false, false, true, true};
        boolean[] lofFlags = {false, true, false, true};
        Map<String, ModelScores> scores = new LinkedHashMap<>();
        scores.put("iforest", new ModelScores("iforest", new double[]{0.1, 0.1, 0.9, 0.9}, iforestFlags));
        scores.put("lof", new ModelScores("lof", new double[]{1.0, 3.0, 1.0, 3.0}, lofFlags));

        List<EnsembleResult> results = combiner.combine(scores,
                stats(new ScoreStats(0.0, 1.0, 0.5, 0.1), new ScoreStats(1.0, 3.0, 1.5, 0.5)),
                Map.of("iforest", 0.5, "lof", 0.5));

        assertThat(results).extracting(EnsembleResult::anomaly).containsExactly(false, true, true, true);
    }

    @Test
    void combine_weightedSumOfNormalizedScores() {
        Map<String, ModelScores> scores = new LinkedHashMap<>();
        scores.put("iforest", new ModelScores("iforest", new double[]{0.5}, new boolean[]{false}));
        scores.put("lof", new ModelScores("lof", new double[]{2.0}, new boolean[]{false}));

        List<EnsembleResult> results = combiner.combine(scores,
                stats(new ScoreStats(0.0, 1.0, 0.5, 0.1), new ScoreStats(1.0, 3.0, 1.5, 0.5)),
                Map.of("iforest", 0.25, "lof", 0.75));

        // 0.25 * 0.5 + 0.75 * 0.5
        assertThat(results.get(0).score()).isCloseTo(0.5, within(1e-8));
    }

    @Test
    void combine_missingWeight_defaultsToEqualShare() {
        Map<String, ModelScores> scores = new LinkedHashMap<>();
        scores.put("iforest", new ModelScores("iforest", new double[]{1.0}, new boolean[]{false}));
        scores.put("lof", new ModelScores("lof", new double[]{3.0}, new boolean[]{false}));

        List<EnsembleResult> results = combiner.combine(scores,
                stats(new ScoreStats(0.0, 1.0, 0.5, 0.1), new ScoreStats(1.0, 3.0, 1.5, 0.5)),
                Map.of());

        assertThat(results.get(0).score()).isCloseTo(1.0, within(1e-8));
    }

    @Test
    void normalize_degenerateTrainingRange_doesNotDivideByZero() {
        ScoreStats flat = new ScoreStats(0.7, 0.7, 0.7, 0.0);

        assertThat(EnsembleCombiner.normalize(0.7, flat)).isEqualTo(0.0);
        assertThat(EnsembleCombiner.normalize(0.9, flat)).isEqualTo(1.0);
        assertThat(EnsembleCombiner.normalize(0.1, flat)).isEqualTo(0.0);
    }
}
