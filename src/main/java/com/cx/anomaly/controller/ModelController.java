package com.cx.anomaly.controller;

import com.cx.anomaly.model.ModelSummary;
import com.cx.anomaly.model.ModelsResponse;
import com.cx.anomaly.registry.ModelArtifact;
import com.cx.anomaly.registry.ModelRegistry;
import com.cx.anomaly.registry.RegistrySnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Tag(name = "Models", description = "Loaded models and artifact reload")
public class ModelController {

    private final ModelRegistry registry;

    public ModelController(ModelRegistry registry) {
        this.registry = registry;
    }

    @Operation(summary = "List loaded models",
            description = "Returns each model in the installed snapshot with its algorithm, calibrated threshold " +
                    "and training metadata, and whether the ensemble is available (two or more models loaded).")
    @GetMapping("/models")
    public ResponseEntity<ModelsResponse> getModels() {
        RegistrySnapshot snapshot = registry.require();

        Map<String, ModelSummary> models = new LinkedHashMap<>();
        for (ModelArtifact artifact : snapshot.getModels().values()) {
            models.put(artifact.name(), ModelSummary.from(artifact.metadata()));
        }
        return ResponseEntity.ok(ModelsResponse.builder()
                .models(models)
                .ensembleAvailable(snapshot.isEnsembleAvailable())
                .loadedAt(snapshot.getLoadedAt())
                .build());
    }

    @Operation(summary = "Reload model artifacts",
            description = "Loads the full artifact set into a new snapshot and swaps it in atomically. " +
                    "In-flight requests finish on the snapshot they started with. If loading fails the " +
                    "previously installed snapshot keeps serving.")
    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        RegistrySnapshot snapshot = registry.reload();
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Models reloaded successfully",
                "models", snapshot.getModelNames(),
                "version", snapshot.getVersion()));
    }
}
