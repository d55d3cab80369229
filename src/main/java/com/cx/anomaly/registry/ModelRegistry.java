package com.cx.anomaly.registry;

import com.cx.anomaly.config.DetectorProperties;
import com.cx.anomaly.config.MetricsConfig;
import com.cx.anomaly.engine.DetectorException;
import com.cx.anomaly.engine.ErrorKind;
import com.cx.anomaly.engine.ensemble.EnsembleResult;
import com.cx.anomaly.engine.ensemble.ModelScores;
import com.cx.anomaly.engine.pipeline.DataTable;
import com.cx.anomaly.engine.pipeline.FittedPipeline;
import com.cx.anomaly.model.GlobalMetadata;
import com.cx.anomaly.model.InteractionRecord;
import com.cx.anomaly.model.ModelSelection;
import com.cx.anomaly.repository.ArtifactRepository;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the serving snapshot. Scoring captures the installed snapshot once and uses it for the
 * whole request; reload builds a complete snapshot off to the side and swaps the reference.
 * Neither side takes a lock, so scoring never waits on reload and reload never waits on scoring.
 */
@Component
public class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final ArtifactRepository artifactRepository;
    private final DetectorProperties properties;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    private final AtomicReference<RegistrySnapshot> active = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();

    public ModelRegistry(ArtifactRepository artifactRepository, DetectorProperties properties,
                         MetricsConfig metricsConfig, Tracer tracer) {
        this.artifactRepository = artifactRepository;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        if (!properties.isLoadOnStartup()) {
            log.info("Skipping model load on startup; registry stays unloaded until POST /reload");
            return;
        }
        try {
            reload();
        } catch (DetectorException e) {
            log.warn("Models not loaded at startup, serving in degraded mode: {}", e.getMessage());
        }
    }

    /**
     * Reads every artifact into a new snapshot without installing it. Fails as a whole if any
     * required artifact is missing or malformed.
     */
    public RegistrySnapshot load() {
        log.info("Loading model artifacts from {}", artifactRepository.location());
        FittedPipeline pipeline = artifactRepository.loadPipeline();
        List<ModelArtifact> models = new ArrayList<>();
        for (String name : properties.modelNames()) {
            ModelArtifact model = artifactRepository.loadModel(name);
            if (model.metadata().getFeatureCount() != pipeline.getFeatureWidth()) {
                throw new DetectorException(ErrorKind.ARTIFACT_MALFORMED, "Artifact "
                        + properties.getArtifacts().modelArtifact(name) + " expects "
                        + model.metadata().getFeatureCount() + " features but the pipeline produces "
                        + pipeline.getFeatureWidth());
            }
            models.add(model);
        }
        GlobalMetadata global = loadGlobalMetadataIfPresent();
        return new RegistrySnapshot(versions.incrementAndGet(), pipeline, models,
                properties.getEnsemble().getWeights(), global, Instant.now());
    }

    /**
     * Loads and installs a new snapshot. On failure the previously installed snapshot keeps serving.
     */
    public RegistrySnapshot reload() {
        RegistrySnapshot snapshot;
        try {
            snapshot = load();
        } catch (DetectorException e) {
            metricsConfig.recordReload("failure");
            log.error("Reload failed, keeping {}: {}", describeActive(), e.getMessage());
            throw e;
        }
        install(snapshot);
        metricsConfig.recordReload("success");
        return snapshot;
    }

    public void install(RegistrySnapshot snapshot) {
        RegistrySnapshot previous = active.getAndSet(snapshot);
        metricsConfig.updateLoadedModelCount(snapshot.getModels().size());
        log.info("Installed snapshot v{} with models {} (replaced {})",
                snapshot.getVersion(), snapshot.getModelNames(),
                previous == null ? "nothing" : "v" + previous.getVersion());
    }

    public Optional<RegistrySnapshot> current() {
        return Optional.ofNullable(active.get());
    }

    public RegistrySnapshot require() {
        RegistrySnapshot snapshot = active.get();
        if (snapshot == null) {
            throw DetectorException.notLoaded();
        }
        return snapshot;
    }

    public boolean isLoaded() {
        return active.get() != null;
    }

    /**
     * Scores request records against the installed snapshot.
     *
     * @throws DetectorException SCHEMA for invalid records, NOT_LOADED before the first load,
     *                           MODEL_UNAVAILABLE when the selected model is not in the snapshot
     */
    @Observed(name = "scoring.score", contextualName = "score-records")
    public ScoringBatch score(List<InteractionRecord> records, ModelSelection selection) {
        RegistrySnapshot snapshot = require();

        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            InteractionRecord record = records.get(i);
            if (record == null) {
                throw DetectorException.schema("Record " + i + " is null");
            }
            List<String> problems = record.violations();
            if (!problems.isEmpty()) {
                throw DetectorException.schema("Record " + i + " (" + record.getInteractionId() + "): "
                        + String.join("; ", problems));
            }
            rows.add(record.toRow());
        }

        List<String> modelNames = selection.isAll()
                ? snapshot.getModelNames()
                : List.of(snapshot.requireModel(selection.getValue()).name());

        metricsConfig.recordScoringRequest(selection.getValue(), records.size());
        return score(snapshot, new DataTable(InteractionRecord.COLUMNS, rows), modelNames, selection.isAll());
    }

    /**
     * Batch entry point: checks the table carries every configured feature and identifier column,
     * then scores it with all models of the snapshot.
     */
    public ScoringBatch scoreTable(RegistrySnapshot snapshot, DataTable table, boolean withEnsemble) {
        properties.featureSpec().validate(table);
        return score(snapshot, table, snapshot.getModelNames(), withEnsemble);
    }

    /**
     * Scores a table with the named models of one snapshot. The ensemble is added when requested
     * and more than one model is scored.
     */
    public ScoringBatch score(RegistrySnapshot snapshot, DataTable table, List<String> modelNames,
                              boolean withEnsemble) {
        double[][] features = snapshot.transform(table);

        Map<String, ModelScores> scoresByModel = new LinkedHashMap<>();
        for (String name : modelNames) {
            ModelArtifact artifact = snapshot.requireModel(name);

            Span modelSpan = tracer.nextSpan()
                    .name("model.score." + name)
                    .tag("model.name", name)
                    .tag("model.algorithm", artifact.detector().getAlgorithm().getDisplayName())
                    .tag("snapshot.version", String.valueOf(snapshot.getVersion()))
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(modelSpan)) {
                ModelScores scores = artifact.score(features);
                scoresByModel.put(name, scores);
                metricsConfig.recordModelScores(name, scores.scores(), scores.anomalyCount());
                modelSpan.tag("anomalies", String.valueOf(scores.anomalyCount()));
            } catch (RuntimeException e) {
                modelSpan.error(e);
                throw e;
            } finally {
                modelSpan.end();
            }
        }

        List<EnsembleResult> ensemble = withEnsemble && scoresByModel.size() > 1
                ? snapshot.combine(scoresByModel)
                : List.of();

        List<String> ids = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            Object id = table.hasColumn("interaction_id") ? table.value(i, "interaction_id") : null;
            ids.add(id == null ? null : id.toString());
        }
        return new ScoringBatch(snapshot.getVersion(), ids, scoresByModel, ensemble);
    }

    private GlobalMetadata loadGlobalMetadataIfPresent() {
        try {
            return artifactRepository.loadGlobalMetadata();
        } catch (DetectorException e) {
            log.warn("Global metadata unavailable: {}", e.getMessage());
            return null;
        }
    }

    private String describeActive() {
        RegistrySnapshot snapshot = active.get();
        return snapshot == null ? "registry unloaded" : "snapshot v" + snapshot.getVersion();
    }
}
