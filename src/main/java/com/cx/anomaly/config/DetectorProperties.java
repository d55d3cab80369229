package com.cx.anomaly.config;

import com.cx.anomaly.engine.DetectorAlgorithm;
import com.cx.anomaly.engine.DetectorException;
import com.cx.anomaly.engine.pipeline.FeatureSpec;
import com.cx.anomaly.engine.pipeline.ImputationStrategy;
import com.cx.anomaly.engine.pipeline.ScalingMethod;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "cx")
public class DetectorProperties {

    private Features features = new Features();

    private Preprocessing preprocessing = new Preprocessing();

    // One entry per trained model. Names must be unique; they key artifacts, weights and API output.
    private List<ModelSpec> models = new ArrayList<>(List.of(
            ModelSpec.of("iforest", "IsolationForest"),
            ModelSpec.of("lof", "LOF")));

    private Ensemble ensemble = new Ensemble();

    private Artifacts artifacts = new Artifacts();

    private DataPaths data = new DataPaths();

    private Scheduler scheduler = new Scheduler();

    private Alerts alerts = new Alerts();

    // Try to install a snapshot when the application starts.
    private boolean loadOnStartup = true;

    @Data
    public static class Features {
        private List<String> numeric = new ArrayList<>(List.of(
                "csat", "ies", "complaints", "aht_seconds", "hold_time_seconds", "transfers"));
        private List<String> categorical = new ArrayList<>(List.of("channel", "language", "queue"));
        private List<String> identifierColumns = new ArrayList<>(List.of("interaction_id", "timestamp"));
        private List<String> dropColumns = new ArrayList<>();
    }

    @Data
    public static class Preprocessing {
        private ImputationStrategy numericStrategy = ImputationStrategy.MEAN;
        // Fill value for the CONSTANT strategy, and the fallback for columns with no observations.
        private double constantFillValue = 0.0;
        private ScalingMethod scaleMethod = ScalingMethod.STANDARD;
    }

    @Data
    public static class ModelSpec {
        private String name;
        private String algorithm;
        private double thresholdPercentile = 95.0;
        private Params params = new Params();

        public static ModelSpec of(String name, String algorithm) {
            ModelSpec spec = new ModelSpec();
            spec.setName(name);
            spec.setAlgorithm(algorithm);
            return spec;
        }

        public DetectorAlgorithm resolveAlgorithm() {
            return DetectorAlgorithm.fromName(algorithm);
        }
    }

    @Data
    public static class Params {
        // isolation forest
        private int numTrees = 200;
        private int subsampleSize = 256;
        private int maxDepth = 0; // 0 = ceil(log2(subsampleSize))
        private long seed = 42L;
        private boolean parallel = false;
        // local outlier factor
        private int neighbors = 20;
    }

    @Data
    public static class Ensemble {
        private Map<String, Double> weights = new LinkedHashMap<>(Map.of("iforest", 0.5, "lof", 0.5));
    }

    @Data
    public static class Artifacts {
        private String store = "filesystem"; // filesystem | aerospike
        private String dir = "./artifacts";
        private String pipeline = "pipeline.json";
        private String modelTemplate = "model_{name}.json";
        private String metaTemplate = "meta_{name}.json";
        private String globalMeta = "meta_global.json";

        public String modelArtifact(String modelName) {
            return modelTemplate.replace("{name}", modelName);
        }

        public String metaArtifact(String modelName) {
            return metaTemplate.replace("{name}", modelName);
        }
    }

    @Data
    public static class DataPaths {
        private String trainPath = "./data/train.csv";
        private String inferencePath = "./data/inference.csv";
        private String outputDir = "./data/output";
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;
        private String cron = "0 0 */6 * * *";
    }

    @Data
    public static class Alerts {
        // Minimum flagged records in a scheduled batch before an alert goes out.
        private int minAnomalies = 1;
    }

    public FeatureSpec featureSpec() {
        return new FeatureSpec(features.getNumeric(), features.getCategorical(),
                features.getIdentifierColumns(), features.getDropColumns());
    }

    public List<String> modelNames() {
        return models.stream().map(ModelSpec::getName).toList();
    }

    /**
     * Fails fast on configuration that could only break later, at train or serve time.
     */
    @PostConstruct
    public void validate() {
        if (features.getNumeric().isEmpty() && features.getCategorical().isEmpty()) {
            throw DetectorException.configuration("At least one numeric or categorical feature is required");
        }
        if (models.isEmpty()) {
            throw DetectorException.configuration("At least one model must be configured");
        }
        Set<String> names = new HashSet<>();
        for (ModelSpec spec : models) {
            if (spec.getName() == null || spec.getName().isBlank()) {
                throw DetectorException.configuration("Every model needs a name");
            }
            if (!names.add(spec.getName())) {
                throw DetectorException.configuration("Duplicate model name: " + spec.getName());
            }
            spec.resolveAlgorithm();
            double p = spec.getThresholdPercentile();
            if (Double.isNaN(p) || p < 0.0 || p > 100.0) {
                throw DetectorException.configuration(
                        "threshold-percentile for " + spec.getName() + " must be within [0, 100]");
            }
            Params params = spec.getParams();
            if (params.getNumTrees() <= 0 || params.getSubsampleSize() <= 0 || params.getNeighbors() <= 0) {
                throw DetectorException.configuration(
                        "num-trees, subsample-size and neighbors must be positive for " + spec.getName());
            }
        }
        for (Map.Entry<String, Double> weight : ensemble.getWeights().entrySet()) {
            if (weight.getValue() == null || weight.getValue() < 0.0) {
                throw DetectorException.configuration("Ensemble weight for " + weight.getKey() + " must be >= 0");
            }
        }
        if (!artifacts.getModelTemplate().contains("{name}") || !artifacts.getMetaTemplate().contains("{name}")) {
            throw DetectorException.configuration("Artifact templates must contain {name}");
        }
    }

    /**
     * Plain-map copy of the training-relevant configuration, stored in global metadata.
     */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("numeric", List.copyOf(features.getNumeric()));
        snapshot.put("categorical", List.copyOf(features.getCategorical()));
        snapshot.put("identifierColumns", List.copyOf(features.getIdentifierColumns()));
        snapshot.put("dropColumns", List.copyOf(features.getDropColumns()));
        snapshot.put("numericStrategy", preprocessing.getNumericStrategy().name());
        snapshot.put("constantFillValue", preprocessing.getConstantFillValue());
        snapshot.put("scaleMethod", preprocessing.getScaleMethod().name());
        List<Map<String, Object>> modelSnapshots = new ArrayList<>();
        for (ModelSpec spec : models) {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("name", spec.getName());
            model.put("algorithm", spec.resolveAlgorithm().getDisplayName());
            model.put("thresholdPercentile", spec.getThresholdPercentile());
            modelSnapshots.add(model);
        }
        snapshot.put("models", modelSnapshots);
        snapshot.put("ensembleWeights", new LinkedHashMap<>(ensemble.getWeights()));
        return snapshot;
    }
}
