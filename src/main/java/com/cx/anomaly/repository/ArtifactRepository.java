package com.cx.anomaly.repository;

import com.cx.anomaly.config.DetectorProperties;
import com.cx.anomaly.engine.AnomalyDetector;
import com.cx.anomaly.engine.DetectorAlgorithm;
import com.cx.anomaly.engine.DetectorException;
import com.cx.anomaly.engine.ErrorKind;
import com.cx.anomaly.engine.isolationforest.IsolationForest;
import com.cx.anomaly.engine.isolationforest.IsolationTree;
import com.cx.anomaly.engine.lof.LocalOutlierFactor;
import com.cx.anomaly.engine.pipeline.FittedPipeline;
import com.cx.anomaly.model.GlobalMetadata;
import com.cx.anomaly.model.ModelMetadata;
import com.cx.anomaly.registry.ModelArtifact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Reads and writes the artifact set: the shared pipeline, a model and metadata document per
 * model name, and the global metadata. Artifact names come from {@code cx.artifacts}.
 */
@Repository
public class ArtifactRepository {

    private static final Logger log = LoggerFactory.getLogger(ArtifactRepository.class);

    private final ArtifactStore store;
    private final DetectorProperties.Artifacts naming;
    private final ObjectMapper objectMapper;

    public ArtifactRepository(ArtifactStore store, DetectorProperties properties) {
        this.store = store;
        this.naming = properties.getArtifacts();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void savePipeline(FittedPipeline pipeline) {
        write(naming.getPipeline(), pipeline);
    }

    public void saveModel(ModelArtifact artifact) {
        write(naming.modelArtifact(artifact.name()), artifact.detector());
        write(naming.metaArtifact(artifact.name()), artifact.metadata());
    }

    public void saveGlobalMetadata(GlobalMetadata metadata) {
        write(naming.getGlobalMeta(), metadata);
    }

    public FittedPipeline loadPipeline() {
        return read(naming.getPipeline(), FittedPipeline.class);
    }

    /**
     * Loads a model and its metadata; the metadata's algorithm decides how the model document is read.
     */
    public ModelArtifact loadModel(String name) {
        ModelMetadata metadata = read(naming.metaArtifact(name), ModelMetadata.class);
        DetectorAlgorithm algorithm;
        try {
            algorithm = DetectorAlgorithm.fromName(metadata.getAlgorithm());
        } catch (DetectorException e) {
            throw new DetectorException(ErrorKind.ARTIFACT_MALFORMED,
                    "Artifact " + naming.metaArtifact(name) + " names an unknown algorithm: " + metadata.getAlgorithm(), e);
        }
        Class<? extends AnomalyDetector> type = switch (algorithm) {
            case ISOLATION_FOREST -> IsolationForest.class;
            case LOCAL_OUTLIER_FACTOR -> LocalOutlierFactor.class;
        };
        AnomalyDetector detector = read(naming.modelArtifact(name), type);
        checkStructure(name, detector, metadata);
        return new ModelArtifact(name, detector, metadata);
    }

    public GlobalMetadata loadGlobalMetadata() {
        return read(naming.getGlobalMeta(), GlobalMetadata.class);
    }

    public String location() {
        return store.location();
    }

    /**
     * Rejects documents that parse but cannot score: an unfitted detector, missing score statistics,
     * or a feature width that disagrees with the metadata.
     */
    private void checkStructure(String name, AnomalyDetector detector, ModelMetadata metadata) {
        String modelArtifact = naming.modelArtifact(name);
        int width;
        if (detector instanceof IsolationForest forest) {
            List<IsolationTree> trees = forest.getTrees();
            if (trees == null || trees.isEmpty()) {
                throw malformed(modelArtifact, "isolation forest has no trees");
            }
            for (int i = 0; i < trees.size(); i++) {
                if (trees.get(i) == null || trees.get(i).getRoot() == null) {
                    throw malformed(modelArtifact, "tree " + i + " has no root");
                }
            }
            if (forest.getSampleSize() < 1) {
                throw malformed(modelArtifact, "sample size must be positive, got " + forest.getSampleSize());
            }
            width = forest.getNumFeatures();
        } else {
            LocalOutlierFactor lof = (LocalOutlierFactor) detector;
            double[][] training = lof.getTrainingData();
            if (training == null || training.length < 2 || training[0] == null) {
                throw malformed(modelArtifact, "local outlier factor has no training data");
            }
            int rows = training.length;
            if (lof.getDensities() == null || lof.getDensities().length != rows
                    || lof.getKDistances() == null || lof.getKDistances().length != rows
                    || lof.getOutlierFactors() == null || lof.getOutlierFactors().length != rows) {
                throw malformed(modelArtifact, "densities, k-distances and outlier factors must cover all "
                        + rows + " training rows");
            }
            if (lof.getNeighbors() < 1 || lof.getNeighbors() >= rows) {
                throw malformed(modelArtifact, "neighbor count " + lof.getNeighbors() + " out of range for "
                        + rows + " training rows");
            }
            width = training[0].length;
            for (double[] row : training) {
                if (row == null || row.length != width) {
                    throw malformed(modelArtifact, "training rows have inconsistent widths");
                }
            }
        }
        if (width < 1) {
            throw malformed(modelArtifact, "feature width must be positive, got " + width);
        }
        if (metadata.getScoreStats() == null) {
            throw malformed(naming.metaArtifact(name), "score statistics are missing");
        }
        if (metadata.getFeatureCount() != width) {
            throw malformed(naming.metaArtifact(name), "feature count " + metadata.getFeatureCount()
                    + " does not match the model's " + width + " features");
        }
    }

    private static DetectorException malformed(String artifactName, String problem) {
        return new DetectorException(ErrorKind.ARTIFACT_MALFORMED, "Artifact " + artifactName + " is malformed: " + problem);
    }

    private void write(String artifactName, Object value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DetectorException(ErrorKind.ARTIFACT_WRITE, "Failed to serialize artifact " + artifactName, e);
        }
        store.write(artifactName, json);
        log.info("Saved artifact {} to {}", artifactName, store.location());
    }

    private <T> T read(String artifactName, Class<T> type) {
        String json = store.read(artifactName)
                .orElseThrow(() -> new DetectorException(ErrorKind.ARTIFACT_MISSING,
                        "Artifact not found: " + artifactName + " in " + store.location()));
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new DetectorException(ErrorKind.ARTIFACT_MALFORMED, "Artifact is empty: " + artifactName);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new DetectorException(ErrorKind.ARTIFACT_MALFORMED,
                    "Artifact is malformed: " + artifactName + " (" + e.getOriginalMessage() + ")", e);
        }
    }
}
