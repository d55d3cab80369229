package com.cx.anomaly.controller;

import com.cx.anomaly.engine.ensemble.EnsembleResult;
import com.cx.anomaly.engine.ensemble.ModelScores;
import com.cx.anomaly.model.InteractionRecord;
import com.cx.anomaly.model.ModelSelection;
import com.cx.anomaly.model.RecordScore;
import com.cx.anomaly.model.ScoreResponse;
import com.cx.anomaly.registry.ModelRegistry;
import com.cx.anomaly.registry.ScoringBatch;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@Tag(name = "Scoring", description = "Real-time anomaly scoring of interactions")
public class ScoringController {

    private static final Logger log = LoggerFactory.getLogger(ScoringController.class);

    static final String ENSEMBLE = "ensemble";

    private final ModelRegistry registry;

    public ScoringController(ModelRegistry registry) {
        this.registry = registry;
    }

    @Operation(summary = "Score a batch of interactions",
            description = "Transforms the records with the fitted feature pipeline and scores them with the selected model. " +
                    "With model=both every loaded model is scored and an 'ensemble' entry is added: the weighted sum of " +
                    "min-max normalized scores, flagged when any model flags the record.")
    @PostMapping("/score")
    public ResponseEntity<?> score(
            @Parameter(description = "Model to score with: iforest, lof or both", example = "both")
            @RequestParam(defaultValue = "both") String model,
            @RequestBody List<InteractionRecord> records) {

        Optional<ModelSelection> selection = ModelSelection.parse(model);
        if (selection.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "model must be one of: " + ModelSelection.allowedValues()));
        }

        long start = System.nanoTime();
        ScoringBatch batch = registry.score(records, selection.get());

        List<RecordScore> scores = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            Map<String, Double> values = new LinkedHashMap<>();
            Map<String, Integer> flags = new LinkedHashMap<>();
            for (Map.Entry<String, ModelScores> entry : batch.modelScores().entrySet()) {
                values.put(entry.getKey(), entry.getValue().scores()[i]);
                flags.put(entry.getKey(), entry.getValue().flags()[i] ? 1 : 0);
            }
            if (batch.hasEnsemble()) {
                EnsembleResult ensemble = batch.ensemble().get(i);
                values.put(ENSEMBLE, ensemble.score());
                flags.put(ENSEMBLE, ensemble.anomaly() ? 1 : 0);
            }
            scores.add(RecordScore.builder()
                    .interactionId(batch.interactionIds().get(i))
                    .scores(values)
                    .isAnomaly(flags)
                    .build());
        }

        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
        int anomalies = batch.anomalyCount();
        log.info("Scored {} records with model={} on snapshot v{}: {} anomalies in {} ms",
                batch.size(), selection.get().getValue(), batch.snapshotVersion(), anomalies,
                String.format("%.2f", elapsedMs));

        return ResponseEntity.ok(ScoreResponse.builder()
                .scores(scores)
                .totalRecords(batch.size())
                .anomaliesDetected(anomalies)
                .processingTimeMs(Math.round(elapsedMs * 100.0) / 100.0)
                .build());
    }
}
