package com.cx.anomaly.engine.isolationforest;

import com.cx.anomaly.engine.AnomalyDetector;
import com.cx.anomaly.engine.DetectorAlgorithm;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Isolation forest over the transformed feature space.
 *
 * Every tree gets its own seed drawn up front from the forest seed, so the forest is identical
 * whether trees are built sequentially or in parallel.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationForest implements AnomalyDetector {

    private List<IsolationTree> trees;
    private int sampleSize;
    private int maxDepth;
    private int numFeatures;

    public IsolationForest() {
        this.trees = new ArrayList<>();
    }

    /**
     * Train the isolation forest on the given data.
     *
     * @param data       training samples, each row is a feature vector
     * @param numTrees   number of trees in the forest
     * @param sampleSize sub-sampling size per tree, capped at the number of rows
     * @param maxDepth   depth limit; non-positive means ceil(log2(sampleSize))
     * @param seed       random seed for reproducibility
     * @param parallel   build trees on the common fork-join pool
     */
    public void train(double[][] data, int numTrees, int sampleSize, int maxDepth, long seed, boolean parallel) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on zero rows");
        }
        this.sampleSize = Math.min(sampleSize, data.length);
        this.maxDepth = maxDepth > 0
                ? maxDepth
                : Math.max(1, (int) Math.ceil(Math.log(this.sampleSize) / Math.log(2)));
        this.numFeatures = data[0].length;

        Random random = new Random(seed);
        long[] treeSeeds = new long[numTrees];
        for (int i = 0; i < numTrees; i++) {
            treeSeeds[i] = random.nextLong();
        }

        IntStream indices = IntStream.range(0, numTrees);
        if (parallel) {
            indices = indices.parallel();
        }
        this.trees = indices
                .mapToObj(i -> buildTree(data, treeSeeds[i]))
                .collect(Collectors.toList());
    }

    private IsolationTree buildTree(double[][] data, long treeSeed) {
        Random random = new Random(treeSeed);
        double[][] sample = subsample(data, sampleSize, random);
        return IsolationTree.build(sample, maxDepth, random);
    }

    /**
     * Compute anomaly score for a single point: s(x, n) = 2^(-E(h(x)) / c(n)).
     *
     * @return score in (0, 1]; values near 1 are anomalous, values well below 0.5 are normal
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) return 0.0;
        if (point.length != numFeatures) {
            throw new IllegalArgumentException("Expected " + numFeatures + " features but got " + point.length);
        }

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        return Math.pow(2.0, -avgPathLength / c);
    }

    @Override
    @JsonIgnore
    public DetectorAlgorithm getAlgorithm() {
        return DetectorAlgorithm.ISOLATION_FOREST;
    }

    @Override
    public double[] scoreSamples(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = anomalyScore(data[i]);
        }
        return scores;
    }

    @Override
    public double[] trainingScores(double[][] trainingData) {
        return scoreSamples(trainingData);
    }

    private double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // partial Fisher-Yates over row indices, without replacement
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    // Getters/setters for serialization
    public List<IsolationTree> getTrees() { return trees; }
    public void setTrees(List<IsolationTree> trees) { this.trees = trees; }
    public int getSampleSize() { return sampleSize; }
    public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }
    public int getMaxDepth() { return maxDepth; }
    public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
    public int getNumFeatures() { return numFeatures; }
    public void setNumFeatures(int numFeatures) { this.numFeatures = numFeatures; }
}
