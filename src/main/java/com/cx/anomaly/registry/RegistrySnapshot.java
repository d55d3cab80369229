package com.cx.anomaly.registry;

import com.cx.anomaly.engine.DetectorException;
import com.cx.anomaly.engine.ErrorKind;
import com.cx.anomaly.engine.ensemble.EnsembleCombiner;
import com.cx.anomaly.engine.ensemble.EnsembleResult;
import com.cx.anomaly.engine.ensemble.ModelScores;
import com.cx.anomaly.engine.pipeline.DataTable;
import com.cx.anomaly.engine.pipeline.FittedPipeline;
import com.cx.anomaly.engine.threshold.ScoreStats;
import com.cx.anomaly.model.GlobalMetadata;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything needed to score a request: the fitted pipeline and the models trained with it.
 * Never mutated after construction; a reload builds a new snapshot instead.
 */
public final class RegistrySnapshot {

    private static final EnsembleCombiner COMBINER = new EnsembleCombiner();

    private final long version;
    private final FittedPipeline pipeline;
    private final Map<String, ModelArtifact> models;
    private final Map<String, Double> weights;
    private final GlobalMetadata globalMetadata;
    private final Instant loadedAt;

    public RegistrySnapshot(long version, FittedPipeline pipeline, List<ModelArtifact> models,
                            Map<String, Double> weights, GlobalMetadata globalMetadata, Instant loadedAt) {
        if (models.isEmpty()) {
            throw new IllegalArgumentException("A snapshot needs at least one model");
        }
        this.version = version;
        this.pipeline = pipeline;
        Map<String, ModelArtifact> byName = new LinkedHashMap<>();
        for (ModelArtifact model : models) {
            byName.put(model.name(), model);
        }
        this.models = Collections.unmodifiableMap(byName);
        this.weights = Map.copyOf(weights);
        this.globalMetadata = globalMetadata;
        this.loadedAt = loadedAt;
    }

    public long getVersion() {
        return version;
    }

    public FittedPipeline getPipeline() {
        return pipeline;
    }

    public Map<String, ModelArtifact> getModels() {
        return models;
    }

    public List<String> getModelNames() {
        return List.copyOf(models.keySet());
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    /** May be null for artifact sets written without global metadata. */
    public GlobalMetadata getGlobalMetadata() {
        return globalMetadata;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public boolean isEnsembleAvailable() {
        return models.size() >= 2;
    }

    public Optional<ModelArtifact> model(String name) {
        return Optional.ofNullable(models.get(name));
    }

    public ModelArtifact requireModel(String name) {
        return model(name).orElseThrow(() -> new DetectorException(ErrorKind.MODEL_UNAVAILABLE,
                "Model '" + name + "' is not loaded. Available: " + models.keySet()));
    }

    public double[][] transform(DataTable table) {
        return pipeline.transform(table);
    }

    public List<EnsembleResult> combine(Map<String, ModelScores> scoresByModel) {
        Map<String, ScoreStats> stats = new LinkedHashMap<>();
        for (String name : scoresByModel.keySet()) {
            stats.put(name, requireModel(name).metadata().getScoreStats());
        }
        return COMBINER.combine(scoresByModel, stats, weights);
    }
}
