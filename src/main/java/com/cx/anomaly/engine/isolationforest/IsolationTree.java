package com.cx.anomaly.engine.isolationforest;

import java.util.Random;

public class IsolationTree {

    private IsolationNode root;

    public IsolationTree() {}

    public IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        return new IsolationTree(buildNode(data, 0, maxDepth, random));
    }

    private static IsolationNode buildNode(double[][] data, int depth, int maxDepth, Random random) {
        int n = data.length;

        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.externalNode(n);
        }

        int numFeatures = data[0].length;
        double[] min = new double[numFeatures];
        double[] max = new double[numFeatures];
        for (int f = 0; f < numFeatures; f++) {
            min[f] = Double.POSITIVE_INFINITY;
            max[f] = Double.NEGATIVE_INFINITY;
        }
        for (double[] row : data) {
            for (int f = 0; f < numFeatures; f++) {
                if (row[f] < min[f]) min[f] = row[f];
                if (row[f] > max[f]) max[f] = row[f];
            }
        }

        // only features that still vary can split this node
        int[] candidates = new int[numFeatures];
        int candidateCount = 0;
        for (int f = 0; f < numFeatures; f++) {
            if (min[f] < max[f]) candidates[candidateCount++] = f;
        }
        if (candidateCount == 0) {
            return IsolationNode.externalNode(n); // all rows identical
        }

        int featureIdx = candidates[random.nextInt(candidateCount)];
        double lo = min[featureIdx];
        double hi = max[featureIdx];
        double splitValue = lo + random.nextDouble() * (hi - lo);
        if (splitValue <= lo) {
            splitValue = Math.nextUp(lo);
        }

        int leftCount = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) leftCount++;
        }

        double[][] leftData = new double[leftCount][];
        double[][] rightData = new double[n - leftCount][];
        int li = 0, ri = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) {
                leftData[li++] = row;
            } else {
                rightData[ri++] = row;
            }
        }

        IsolationNode left = buildNode(leftData, depth + 1, maxDepth, random);
        IsolationNode right = buildNode(rightData, depth + 1, maxDepth, random);

        return IsolationNode.internalNode(featureIdx, splitValue, left, right);
    }

    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    public IsolationNode getRoot() { return root; }
    public void setRoot(IsolationNode root) { this.root = root; }
}
