package com.cx.anomaly.service;

import com.cx.anomaly.engine.pipeline.DataTable;

import java.nio.file.Path;

/**
 * Result table of a batch prediction, with where it was written when it was saved.
 */
public record PredictionResult(DataTable results, int totalRecords, int anomaliesDetected,
                               long snapshotVersion, Path outputPath) {

    public PredictionResult withOutputPath(Path path) {
        return new PredictionResult(results, totalRecords, anomaliesDetected, snapshotVersion, path);
    }
}
