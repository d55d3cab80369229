package com.cx.anomaly.service;

import com.cx.anomaly.engine.ensemble.ModelScores;
import com.cx.anomaly.engine.pipeline.DataTable;
import com.cx.anomaly.engine.threshold.ThresholdCalibrator;
import com.cx.anomaly.registry.ModelRegistry;
import com.cx.anomaly.registry.RegistrySnapshot;
import com.cx.anomaly.registry.ScoringBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares the loaded models on a table: how much each flags, how its scores are spread, and
 * how strongly the two models' scores agree.
 */
@Service
public class ModelEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(ModelEvaluationService.class);

    private final ModelRegistry registry;

    public ModelEvaluationService(ModelRegistry registry) {
        this.registry = registry;
    }

    public record ModelEvaluation(String model, double threshold, int anomalies, double anomalyRate,
                                  double min, double max, double mean, double median) {}

    /**
     * {@code correlation} is the Pearson correlation of the first two models' scores, or null
     * when fewer than two models are loaded.
     */
    public record EvaluationReport(int totalSamples, Map<String, ModelEvaluation> models, Double correlation) {}

    public EvaluationReport evaluate(RegistrySnapshot snapshot, DataTable table) {
        ScoringBatch batch = registry.scoreTable(snapshot, table, false);

        Map<String, ModelEvaluation> models = new LinkedHashMap<>();
        for (ModelScores scores : batch.modelScores().values()) {
            double[] values = scores.scores();
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            double sum = 0.0;
            for (double v : values) {
                min = Math.min(min, v);
                max = Math.max(max, v);
                sum += v;
            }
            int anomalies = scores.anomalyCount();
            ModelEvaluation evaluation = new ModelEvaluation(scores.model(),
                    snapshot.requireModel(scores.model()).threshold(),
                    anomalies, values.length == 0 ? 0.0 : (double) anomalies / values.length,
                    min, max, values.length == 0 ? 0.0 : sum / values.length,
                    values.length == 0 ? Double.NaN : ThresholdCalibrator.percentile(values, 50.0));
            models.put(scores.model(), evaluation);
            log.info("{} - anomalies detected: {} ({}%), scores min={} max={} mean={} median={}",
                    scores.model(), anomalies, String.format("%.2f", 100.0 * evaluation.anomalyRate()),
                    String.format("%.4f", min), String.format("%.4f", max),
                    String.format("%.4f", evaluation.mean()), String.format("%.4f", evaluation.median()));
        }

        Double correlation = null;
        List<ModelScores> scored = new ArrayList<>(batch.modelScores().values());
        if (scored.size() >= 2) {
            correlation = pearson(scored.get(0).scores(), scored.get(1).scores());
            log.info("Score correlation between {} and {}: {}", scored.get(0).model(), scored.get(1).model(),
                    String.format("%.4f", correlation));
        }
        log.info("Evaluation summary - total samples: {}", batch.size());
        return new EvaluationReport(batch.size(), models, correlation);
    }

    /**
     * Pearson correlation coefficient; NaN when either series is constant.
     */
    static double pearson(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Series differ in length");
        }
        int n = x.length;
        double meanX = 0.0;
        double meanY = 0.0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;
        double cov = 0.0;
        double varX = 0.0;
        double varY = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            cov += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0.0 || varY == 0.0) return Double.NaN;
        return cov / Math.sqrt(varX * varY);
    }
}
