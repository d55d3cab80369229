package com.cx.anomaly.service;

import com.cx.anomaly.config.DetectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic batch scoring of {@code cx.data.inference-path}. Only active with {@code cx.scheduler.enabled=true}.
 */
@Service
@ConditionalOnProperty(name = "cx.scheduler.enabled", havingValue = "true")
public class BatchScoringScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScoringScheduler.class);

    static final String JOB_NAME = "batch-scoring";

    private final BatchPredictionService predictionService;
    private final AlertNotifier notifier;
    private final DetectorProperties properties;

    public BatchScoringScheduler(BatchPredictionService predictionService,
                                 AlertNotifier notifier,
                                 DetectorProperties properties) {
        this.predictionService = predictionService;
        this.notifier = notifier;
        this.properties = properties;
        log.info("Batch scoring scheduled with cron '{}'", properties.getScheduler().getCron());
    }

    @Scheduled(cron = "${cx.scheduler.cron:0 0 */6 * * *}")
    public void runBatchScoring() {
        log.info("=== Starting scheduled batch scoring ===");
        try {
            PredictionResult result = predictionService.predictAndSave();
            log.info("Batch scoring complete: {} anomalies in {} records, written to {}",
                    result.anomaliesDetected(), result.totalRecords(), result.outputPath());
            if (result.anomaliesDetected() >= properties.getAlerts().getMinAnomalies()) {
                notifier.notifyAnomalies(result);
            }
        } catch (RuntimeException e) {
            log.error("Scheduled batch scoring failed: {}", e.getMessage(), e);
            notifier.notifyJobFailure(JOB_NAME, e);
        }
    }
}
