package com.cx.anomaly.engine.lof;

import com.cx.anomaly.engine.AnomalyDetector;
import com.cx.anomaly.engine.DetectorAlgorithm;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Local outlier factor detector in novelty mode: fitting memorizes the training rows together
 * with their k-distances and local reachability densities; scoring compares a query's density
 * with the densities of its k nearest training rows.
 *
 * <ul>
 *   <li>k-distance(B): distance from B to its k-th nearest neighbor</li>
 *   <li>reach-dist(A, B) = max(k-distance(B), d(A, B))</li>
 *   <li>lrd(A) = 1 / mean over neighbors B of reach-dist(A, B)</li>
 *   <li>LOF(A) = mean over neighbors B of lrd(B) / lrd(A)</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LocalOutlierFactor implements AnomalyDetector {

    // keeps lrd finite when a point has k exact duplicates
    private static final double DENSITY_EPSILON = 1e-10;

    private int neighbors;
    private double[][] trainingData;
    private double[] kDistances;
    private double[] densities;
    private double[] outlierFactors;

    public LocalOutlierFactor() {}

    /**
     * @param data      training rows in the transformed feature space
     * @param neighbors requested k; capped at rows - 1
     */
    public void train(double[][] data, int neighbors) {
        int n = data.length;
        if (n < 2) {
            throw new IllegalArgumentException("Local outlier factor needs at least 2 training rows, got " + n);
        }
        this.neighbors = Math.max(1, Math.min(neighbors, n - 1));
        this.trainingData = data;

        int[][] neighborhoods = new int[n][];
        double[][] distances = new double[n][];
        this.kDistances = new double[n];
        for (int i = 0; i < n; i++) {
            List<Neighbor> nearest = NeighborSearch.nearest(data, data[i], this.neighbors, i);
            neighborhoods[i] = new int[nearest.size()];
            distances[i] = new double[nearest.size()];
            for (int j = 0; j < nearest.size(); j++) {
                neighborhoods[i][j] = nearest.get(j).index();
                distances[i][j] = nearest.get(j).distance();
            }
            kDistances[i] = distances[i][distances[i].length - 1];
        }

        this.densities = new double[n];
        for (int i = 0; i < n; i++) {
            densities[i] = reachabilityDensity(neighborhoods[i], distances[i]);
        }

        this.outlierFactors = new double[n];
        for (int i = 0; i < n; i++) {
            outlierFactors[i] = outlierFactor(neighborhoods[i], densities[i]);
        }
    }

    @Override
    @JsonIgnore
    public DetectorAlgorithm getAlgorithm() {
        return DetectorAlgorithm.LOCAL_OUTLIER_FACTOR;
    }

    @Override
    public double[] scoreSamples(double[][] data) {
        requireTrained();
        double[] scores = new double[data.length];
        for (int row = 0; row < data.length; row++) {
            List<Neighbor> nearest = NeighborSearch.nearest(trainingData, data[row], neighbors,
                    NeighborSearch.NO_EXCLUSION);
            int[] indices = new int[nearest.size()];
            double[] distances = new double[nearest.size()];
            for (int j = 0; j < nearest.size(); j++) {
                indices[j] = nearest.get(j).index();
                distances[j] = nearest.get(j).distance();
            }
            scores[row] = outlierFactor(indices, reachabilityDensity(indices, distances));
        }
        return scores;
    }

    /**
     * The fit-time factors, where each training row's neighborhood excludes the row itself.
     */
    @Override
    public double[] trainingScores(double[][] trainingData) {
        requireTrained();
        return outlierFactors.clone();
    }

    private double reachabilityDensity(int[] neighborhood, double[] distances) {
        double sum = 0.0;
        for (int j = 0; j < neighborhood.length; j++) {
            sum += Math.max(kDistances[neighborhood[j]], distances[j]);
        }
        return 1.0 / (sum / neighborhood.length + DENSITY_EPSILON);
    }

    private double outlierFactor(int[] neighborhood, double density) {
        double sum = 0.0;
        for (int index : neighborhood) {
            sum += densities[index];
        }
        return sum / neighborhood.length / density;
    }

    private void requireTrained() {
        if (trainingData == null) {
            throw new IllegalStateException("Local outlier factor model has not been trained");
        }
    }

    // Getters/setters for serialization
    public int getNeighbors() { return neighbors; }
    public void setNeighbors(int neighbors) { this.neighbors = neighbors; }
    public double[][] getTrainingData() { return trainingData; }
    public void setTrainingData(double[][] trainingData) { this.trainingData = trainingData; }
    public double[] getKDistances() { return kDistances; }
    public void setKDistances(double[] kDistances) { this.kDistances = kDistances; }
    public double[] getDensities() { return densities; }
    public void setDensities(double[] densities) { this.densities = densities; }
    public double[] getOutlierFactors() { return outlierFactors; }
    public void setOutlierFactors(double[] outlierFactors) { this.outlierFactors = outlierFactors; }
}
