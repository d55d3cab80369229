package com.cx.anomaly.engine.pipeline;

import com.cx.anomaly.engine.DetectorException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Which columns feed feature construction and which only pass through.
 * Identifier and dropped columns are never used as features, even if also listed as features.
 */
public record FeatureSpec(List<String> numeric,
                          List<String> categorical,
                          List<String> identifierColumns,
                          List<String> dropColumns) {

    public FeatureSpec {
        numeric = List.copyOf(numeric);
        categorical = List.copyOf(categorical);
        identifierColumns = List.copyOf(identifierColumns);
        dropColumns = dropColumns == null ? List.of() : List.copyOf(dropColumns);
    }

    public List<String> numericFeatures() {
        return featureColumns(numeric);
    }

    public List<String> categoricalFeatures() {
        return featureColumns(categorical);
    }

    /**
     * Fails with a schema error naming every required column absent from the table.
     */
    public void validate(DataTable table) {
        Set<String> required = new LinkedHashSet<>();
        required.addAll(numeric);
        required.addAll(categorical);
        required.addAll(identifierColumns);

        Set<String> missing = new TreeSet<>();
        for (String column : required) {
            if (!table.hasColumn(column)) missing.add(column);
        }
        if (!missing.isEmpty()) {
            throw DetectorException.schema("Input is missing required columns: " + missing);
        }
    }

    private List<String> featureColumns(List<String> candidates) {
        List<String> result = new ArrayList<>();
        for (String column : candidates) {
            if (!identifierColumns.contains(column) && !dropColumns.contains(column)) {
                result.add(column);
            }
        }
        return result;
    }
}
