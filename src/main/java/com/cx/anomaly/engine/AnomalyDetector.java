package com.cx.anomaly.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A fitted unsupervised detector. Scores follow one convention for every implementation:
 * higher means more anomalous.
 */
public interface AnomalyDetector {

    @JsonIgnore
    DetectorAlgorithm getAlgorithm();

    /**
     * Scores rows that were not necessarily part of the training set.
     */
    double[] scoreSamples(double[][] data);

    /**
     * Scores of the training rows as seen at fit time; these feed threshold calibration.
     */
    double[] trainingScores(double[][] trainingData);
}
