package com.cx.anomaly.engine.pipeline;

import java.util.List;

/**
 * Learned vocabulary for one categorical column, sorted. Values outside the vocabulary
 * encode as all zeros.
 */
public record CategoricalColumn(String name, List<String> vocabulary) {

    public static final String MISSING = "missing";

    public CategoricalColumn {
        vocabulary = List.copyOf(vocabulary);
    }

    public int width() {
        return vocabulary.size();
    }

    /**
     * Writes the one-hot indicator for {@code value} into {@code target} starting at {@code offset}.
     */
    public void encode(String value, double[] target, int offset) {
        int index = vocabulary.indexOf(value == null ? MISSING : value);
        if (index >= 0) {
            target[offset + index] = 1.0;
        }
    }
}
