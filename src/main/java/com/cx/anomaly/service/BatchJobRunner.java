package com.cx.anomaly.service;

import com.cx.anomaly.config.DetectorProperties;
import com.cx.anomaly.registry.ModelRegistry;
import com.cx.anomaly.repository.InteractionCsvRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;

/**
 * Runs the batch commands. Activate with the {@code train}, {@code predict} or {@code evaluate} profile:
 *
 *   mvn spring-boot:run -Dspring-boot.run.profiles=train
 *   mvn spring-boot:run -Dspring-boot.run.profiles=train,predict
 *
 * Failures propagate out of {@link #run}, so the process exits non-zero.
 */
@Component
@Profile({"train", "predict", "evaluate"})
public class BatchJobRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchJobRunner.class);

    private final ModelTrainingService trainingService;
    private final BatchPredictionService predictionService;
    private final ModelEvaluationService evaluationService;
    private final ModelRegistry registry;
    private final InteractionCsvRepository csvRepository;
    private final DetectorProperties properties;
    private final Environment environment;

    public BatchJobRunner(ModelTrainingService trainingService,
                          BatchPredictionService predictionService,
                          ModelEvaluationService evaluationService,
                          ModelRegistry registry,
                          InteractionCsvRepository csvRepository,
                          DetectorProperties properties,
                          Environment environment) {
        this.trainingService = trainingService;
        this.predictionService = predictionService;
        this.evaluationService = evaluationService;
        this.registry = registry;
        this.csvRepository = csvRepository;
        this.properties = properties;
        this.environment = environment;
    }

    @Override
    public void run(String... args) {
        if (environment.acceptsProfiles(Profiles.of("train"))) {
            TrainingResult result = trainingService.trainAndPersist();
            log.info("Train command finished: {} models on {} rows",
                    result.models().size(), result.globalMetadata().getSampleCount());
        }
        if (environment.acceptsProfiles(Profiles.of("predict"))) {
            // pick up artifacts written by a train run in the same process
            registry.reload();
            PredictionResult result = predictionService.predictAndSave();
            log.info("Predict command finished: {} anomalies in {} records -> {}",
                    result.anomaliesDetected(), result.totalRecords(), result.outputPath());
        }
        if (environment.acceptsProfiles(Profiles.of("evaluate"))) {
            ModelEvaluationService.EvaluationReport report = evaluationService.evaluate(registry.load(),
                    csvRepository.read(Paths.get(properties.getData().getTrainPath())));
            log.info("Evaluate command finished: {} samples, models {}",
                    report.totalSamples(), report.models().keySet());
        }
    }
}
