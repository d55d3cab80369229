package com.cx.anomaly.engine.lof;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LocalOutlierFactorTest {

    private static double[][] cluster(int rows, long seed) {
        Random random = new Random(seed);
        double[][] data = new double[rows][];
        for (int i = 0; i < rows; i++) {
            data[i] = new double[]{random.nextGaussian(), random.nextGaussian(), random.nextGaussian()};
        }
        return data;
    }

    @Test
    void scoreSamples_invariantToTrainingRowOrder() {
        double[][] data = cluster(200, 11L);
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < data.length; i++) order.add(i);
        Collections.shuffle(order, new Random(5L));
        double[][] shuffled = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            shuffled[i] = data[order.get(i)];
        }

        LocalOutlierFactor original = new LocalOutlierFactor();
        original.train(data, 15);
        LocalOutlierFactor permuted = new LocalOutlierFactor();
        permuted.train(shuffled, 15);

        double[][] queries = cluster(30, 99L);
        double[] expected = original.scoreSamples(queries);
        double[] actual = permuted.scoreSamples(queries);
        for (int i = 0; i < queries.length; i++) {
            assertThat(actual[i]).isCloseTo(expected[i], within(1e-9));
        }

        double[] originalTraining = original.trainingScores(data);
        double[] permutedTraining = permuted.trainingScores(shuffled);
        for (int i = 0; i < data.length; i++) {
            assertThat(permutedTraining[i]).isCloseTo(originalTraining[order.get(i)], within(1e-9));
        }
    }

    @Test
    void scoreSamples_isolatedPointScoresAboveOne() {
        LocalOutlierFactor lof = new LocalOutlierFactor();
        lof.train(cluster(300, 12L), 20);

        double[] scores = lof.scoreSamples(new double[][]{{0.0, 0.0, 0.0}, {10.0, 10.0, 10.0}});

        assertThat(scores[0]).isCloseTo(1.0, within(0.5));
        assertThat(scores[1]).isGreaterThan(3.0);
    }

    @Test
    void train_kIsCappedAtRowsMinusOne() {
        LocalOutlierFactor lof = new LocalOutlierFactor();
        lof.train(cluster(5, 13L), 20);

        assertThat(lof.getNeighbors()).isEqualTo(4);
        assertThat(lof.trainingScores(null)).hasSize(5);
    }

    @Test
    void train_handComputedFactors() {
        // points on a line: 0, 1, 2, 10 with k = 1
        double[][] data = {{0.0}, {1.0}, {2.0}, {10.0}};
        LocalOutlierFactor lof = new LocalOutlierFactor();
        lof.train(data, 1);

        // k-distances: 1, 1, 1, 8; lrd: 1, 1, 1, 1/8
        assertThat(lof.getKDistances()).containsExactly(1.0, 1.0, 1.0, 8.0);
        double[] factors = lof.trainingScores(data);
        assertThat(factors[0]).isCloseTo(1.0, within(1e-6));
        assertThat(factors[1]).isCloseTo(1.0, within(1e-6));
        // nearest neighbour of 10 is 2 (lrd 1): 1 / (1/8) = 8
        assertThat(factors[3]).isCloseTo(8.0, within(1e-6));
    }

    @Test
    void nearest_tiesBrokenByRowOrder() {
        double[][] data = {{1.0}, {-1.0}, {1.0}, {-1.0}};

        List<Neighbor> nearest = NeighborSearch.nearest(data, new double[]{0.0}, 2, NeighborSearch.NO_EXCLUSION);

        assertThat(nearest).extracting(Neighbor::index).containsExactly(0, 1);
    }

    @Test
    void train_singleRow_throws() {
        LocalOutlierFactor lof = new LocalOutlierFactor();
        assertThatThrownBy(() -> lof.train(new double[][]{{1.0}}, 5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
