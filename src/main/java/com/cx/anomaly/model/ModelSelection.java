package com.cx.anomaly.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Which models a scoring request asks for. {@code both} scores every loaded model and adds the ensemble.
 */
public enum ModelSelection {

    IFOREST("iforest"),
    LOF("lof"),
    BOTH("both");

    private final String value;

    ModelSelection(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isAll() {
        return this == BOTH;
    }

    public static Optional<ModelSelection> parse(String raw) {
        if (raw == null) return Optional.of(BOTH);
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.value.equals(normalized))
                .findFirst();
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(ModelSelection::getValue).collect(Collectors.joining(", "));
    }
}
