package com.cx.anomaly.service;

import com.cx.anomaly.config.DetectorProperties;
import com.cx.anomaly.engine.ensemble.EnsembleResult;
import com.cx.anomaly.engine.ensemble.ModelScores;
import com.cx.anomaly.engine.pipeline.DataTable;
import com.cx.anomaly.registry.ModelRegistry;
import com.cx.anomaly.registry.RegistrySnapshot;
import com.cx.anomaly.registry.ScoringBatch;
import com.cx.anomaly.repository.InteractionCsvRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a whole inference table with every loaded model plus the ensemble.
 */
@Service
public class BatchPredictionService {

    private static final Logger log = LoggerFactory.getLogger(BatchPredictionService.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ModelRegistry registry;
    private final InteractionCsvRepository csvRepository;
    private final DetectorProperties properties;

    public BatchPredictionService(ModelRegistry registry,
                                  InteractionCsvRepository csvRepository,
                                  DetectorProperties properties) {
        this.registry = registry;
        this.csvRepository = csvRepository;
        this.properties = properties;
    }

    /**
     * Result columns: {@code timestamp} (when the input has it), {@code interaction_id}, then
     * {@code <model>_score} and {@code <model>_anomaly} per model, then {@code ensemble_score}
     * and {@code ensemble_anomaly} when two or more models are loaded. Flags are written as 0/1.
     */
    public PredictionResult predict(RegistrySnapshot snapshot, DataTable table) {
        ScoringBatch batch = registry.scoreTable(snapshot, table, true);
        boolean withTimestamp = table.hasColumn("timestamp");

        List<String> columns = new ArrayList<>();
        if (withTimestamp) columns.add("timestamp");
        columns.add("interaction_id");
        for (String model : batch.modelScores().keySet()) {
            columns.add(model + "_score");
            columns.add(model + "_anomaly");
        }
        if (batch.hasEnsemble()) {
            columns.add("ensemble_score");
            columns.add("ensemble_anomaly");
        }

        List<Map<String, Object>> rows = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            if (withTimestamp) row.put("timestamp", table.value(i, "timestamp"));
            row.put("interaction_id", batch.interactionIds().get(i));
            for (Map.Entry<String, ModelScores> entry : batch.modelScores().entrySet()) {
                row.put(entry.getKey() + "_score", entry.getValue().scores()[i]);
                row.put(entry.getKey() + "_anomaly", entry.getValue().flags()[i] ? 1 : 0);
            }
            if (batch.hasEnsemble()) {
                EnsembleResult ensemble = batch.ensemble().get(i);
                row.put("ensemble_score", ensemble.score());
                row.put("ensemble_anomaly", ensemble.anomaly() ? 1 : 0);
            }
            rows.add(row);
        }

        for (ModelScores scores : batch.modelScores().values()) {
            log.info("{} - detected {} anomalies ({}%)", scores.model(), scores.anomalyCount(),
                    String.format("%.2f", percent(scores.anomalyCount(), batch.size())));
        }
        int anomalies = batch.anomalyCount();
        log.info("Batch prediction: {} of {} records flagged", anomalies, batch.size());
        return new PredictionResult(new DataTable(columns, rows), batch.size(), anomalies,
                snapshot.getVersion(), null);
    }

    /**
     * Scores {@code cx.data.inference-path} and writes {@code anomalies_<timestamp>.csv} to
     * {@code cx.data.output-dir}. Uses the installed snapshot, or loads one when the registry is empty.
     */
    public PredictionResult predictAndSave() {
        RegistrySnapshot snapshot = registry.current().orElseGet(registry::load);
        DataTable table = csvRepository.read(Paths.get(properties.getData().getInferencePath()));
        PredictionResult result = predict(snapshot, table);

        String stamp = ZonedDateTime.now(ZoneOffset.UTC).format(FILE_TIMESTAMP);
        Path output = Paths.get(properties.getData().getOutputDir()).resolve("anomalies_" + stamp + ".csv");
        csvRepository.write(output, result.results());
        log.info("Saved predictions to {}", output);
        return result.withOutputPath(output);
    }

    private static double percent(int count, int total) {
        return total == 0 ? 0.0 : 100.0 * count / total;
    }
}
