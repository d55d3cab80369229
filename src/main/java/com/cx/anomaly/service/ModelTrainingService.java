package com.cx.anomaly.service;

import com.cx.anomaly.config.DetectorProperties;
import com.cx.anomaly.engine.AnomalyDetector;
import com.cx.anomaly.engine.pipeline.DataTable;
import com.cx.anomaly.engine.pipeline.FeaturePipeline;
import com.cx.anomaly.engine.pipeline.FittedPipeline;
import com.cx.anomaly.engine.threshold.Calibration;
import com.cx.anomaly.engine.threshold.ThresholdCalibrator;
import com.cx.anomaly.model.GlobalMetadata;
import com.cx.anomaly.model.ModelMetadata;
import com.cx.anomaly.registry.ModelArtifact;
import com.cx.anomaly.repository.ArtifactRepository;
import com.cx.anomaly.repository.InteractionCsvRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ModelTrainingService {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainingService.class);

    private final DetectorProperties properties;
    private final DetectorFactory detectorFactory;
    private final ArtifactRepository artifactRepository;
    private final InteractionCsvRepository csvRepository;
    private final ThresholdCalibrator calibrator = new ThresholdCalibrator();

    public ModelTrainingService(DetectorProperties properties,
                                DetectorFactory detectorFactory,
                                ArtifactRepository artifactRepository,
                                InteractionCsvRepository csvRepository) {
        this.properties = properties;
        this.detectorFactory = detectorFactory;
        this.artifactRepository = artifactRepository;
        this.csvRepository = csvRepository;
    }

    /**
     * Fit the pipeline and every configured model on the given table, then calibrate each
     * model's threshold on its own training scores. Nothing is persisted.
     */
    public TrainingResult train(DataTable table) {
        log.info("=== Training {} models on {} rows ===", properties.getModels().size(), table.size());
        // resolve every algorithm before spending time on fitting
        properties.getModels().forEach(DetectorProperties.ModelSpec::resolveAlgorithm);

        DetectorProperties.Preprocessing preprocessing = properties.getPreprocessing();
        FeaturePipeline pipeline = new FeaturePipeline(properties.featureSpec(),
                preprocessing.getNumericStrategy(), preprocessing.getConstantFillValue(),
                preprocessing.getScaleMethod());
        FittedPipeline fitted = pipeline.fit(table);
        double[][] features = pipeline.transform(table);

        String trainedAt = Instant.now().toString();
        List<ModelArtifact> models = new ArrayList<>();
        Map<String, boolean[]> trainingFlags = new LinkedHashMap<>();

        for (DetectorProperties.ModelSpec spec : properties.getModels()) {
            long start = System.currentTimeMillis();
            AnomalyDetector detector = detectorFactory.fit(spec, features);
            double[] scores = detector.trainingScores(features);
            Calibration calibration = calibrator.calibrate(scores, spec.getThresholdPercentile());

            boolean[] flags = new boolean[scores.length];
            int flagged = 0;
            for (int i = 0; i < scores.length; i++) {
                flags[i] = calibration.isAnomaly(scores[i]);
                if (flags[i]) flagged++;
            }
            trainingFlags.put(spec.getName(), flags);

            ModelMetadata metadata = ModelMetadata.builder()
                    .algorithm(detector.getAlgorithm().getDisplayName())
                    .trainTimestamp(trainedAt)
                    .sampleCount(features.length)
                    .featureCount(fitted.getFeatureWidth())
                    .threshold(calibration.threshold())
                    .thresholdPercentile(calibration.percentile())
                    .modelParams(detectorFactory.describe(detector))
                    .scoreStats(calibration.stats())
                    .build();
            models.add(new ModelArtifact(spec.getName(), detector, metadata));

            log.info("Trained {} ({}) in {} ms: threshold={} at p{}, scores min={} max={} mean={} std={}, flagged {}/{}",
                    spec.getName(), metadata.getAlgorithm(), System.currentTimeMillis() - start,
                    String.format("%.4f", calibration.threshold()), calibration.percentile(),
                    String.format("%.4f", calibration.stats().min()), String.format("%.4f", calibration.stats().max()),
                    String.format("%.4f", calibration.stats().mean()), String.format("%.4f", calibration.stats().std()),
                    flagged, scores.length);
        }

        GlobalMetadata global = GlobalMetadata.builder()
                .trainTimestamp(trainedAt)
                .sampleCount(features.length)
                .featureCount(fitted.getFeatureWidth())
                .modelsTrained(models.stream().map(ModelArtifact::name).toList())
                .featureNames(fitted.getFeatureNames())
                .configSnapshot(properties.toSnapshot())
                .build();

        log.info("=== Training complete: {} models, {} features ===", models.size(), fitted.getFeatureWidth());
        return new TrainingResult(fitted, models, trainingFlags, global);
    }

    public void persist(TrainingResult result) {
        artifactRepository.savePipeline(result.pipeline());
        for (ModelArtifact model : result.models()) {
            artifactRepository.saveModel(model);
        }
        artifactRepository.saveGlobalMetadata(result.globalMetadata());
        log.info("Persisted {} model artifacts to {}", result.models().size(), artifactRepository.location());
    }

    /**
     * Reads {@code cx.data.train-path}, trains, and persists every artifact.
     */
    public TrainingResult trainAndPersist() {
        DataTable table = csvRepository.read(Paths.get(properties.getData().getTrainPath()));
        TrainingResult result = train(table);
        persist(result);
        return result;
    }
}
