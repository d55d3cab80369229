package com.cx.anomaly.service;

import com.cx.anomaly.config.DetectorProperties;
import com.cx.anomaly.engine.AnomalyDetector;
import com.cx.anomaly.engine.DetectorAlgorithm;
import com.cx.anomaly.engine.isolationforest.IsolationForest;
import com.cx.anomaly.engine.lof.LocalOutlierFactor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fits the detector a model entry asks for. The algorithm name is resolved here, so an
 * unsupported name fails with a configuration error before any fitting starts.
 */
@Component
public class DetectorFactory {

    public AnomalyDetector fit(DetectorProperties.ModelSpec spec, double[][] features) {
        DetectorProperties.Params params = spec.getParams();
        DetectorAlgorithm algorithm = spec.resolveAlgorithm();
        return switch (algorithm) {
            case ISOLATION_FOREST -> {
                IsolationForest forest = new IsolationForest();
                forest.train(features, params.getNumTrees(), params.getSubsampleSize(),
                        params.getMaxDepth(), params.getSeed(), params.isParallel());
                yield forest;
            }
            case LOCAL_OUTLIER_FACTOR -> {
                LocalOutlierFactor lof = new LocalOutlierFactor();
                lof.train(features, params.getNeighbors());
                yield lof;
            }
        };
    }

    /**
     * Hyperparameters as fitted, recorded in model metadata. Effective values (after capping
     * to the training size) are reported rather than the configured ones.
     */
    public Map<String, Object> describe(AnomalyDetector detector) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (detector instanceof IsolationForest forest) {
            params.put("numTrees", forest.getTrees().size());
            params.put("subsampleSize", forest.getSampleSize());
            params.put("maxDepth", forest.getMaxDepth());
        } else if (detector instanceof LocalOutlierFactor lof) {
            params.put("neighbors", lof.getNeighbors());
            params.put("metric", "euclidean");
        }
        return params;
    }
}
