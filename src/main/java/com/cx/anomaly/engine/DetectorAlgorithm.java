package com.cx.anomaly.engine;

import java.util.Locale;

/**
 * Supported unsupervised detectors. The display name is what gets persisted in model metadata.
 */
public enum DetectorAlgorithm {

    ISOLATION_FOREST("IsolationForest", "iforest"),
    LOCAL_OUTLIER_FACTOR("LOF", "lof");

    private final String displayName;
    private final String alias;

    DetectorAlgorithm(String displayName, String alias) {
        this.displayName = displayName;
        this.alias = alias;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static DetectorAlgorithm fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (DetectorAlgorithm algorithm : values()) {
                if (algorithm.displayName.toLowerCase(Locale.ROOT).equals(normalized)
                        || algorithm.alias.equals(normalized)
                        || algorithm.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return algorithm;
                }
            }
        }
        throw DetectorException.configuration("Unsupported algorithm: " + name);
    }
}
