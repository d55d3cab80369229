package com.cx.anomaly.engine.pipeline;

import com.cx.anomaly.engine.DetectorException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable result of fitting the feature pipeline. Shared by every model trained alongside it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FittedPipeline {

    private final List<NumericColumn> numericColumns;
    private final List<CategoricalColumn> categoricalColumns;

    @JsonCreator
    public FittedPipeline(@JsonProperty("numericColumns") List<NumericColumn> numericColumns,
                          @JsonProperty("categoricalColumns") List<CategoricalColumn> categoricalColumns) {
        this.numericColumns = List.copyOf(numericColumns);
        this.categoricalColumns = List.copyOf(categoricalColumns);
    }

    public List<NumericColumn> getNumericColumns() {
        return numericColumns;
    }

    public List<CategoricalColumn> getCategoricalColumns() {
        return categoricalColumns;
    }

    @JsonIgnore
    public int getFeatureWidth() {
        int width = numericColumns.size();
        for (CategoricalColumn column : categoricalColumns) {
            width += column.width();
        }
        return width;
    }

    /**
     * Output column names: numeric columns as-is, one-hot columns as {@code column_value}.
     */
    @JsonIgnore
    public List<String> getFeatureNames() {
        List<String> names = new ArrayList<>(getFeatureWidth());
        for (NumericColumn column : numericColumns) {
            names.add(column.name());
        }
        for (CategoricalColumn column : categoricalColumns) {
            for (String value : column.vocabulary()) {
                names.add(column.name() + "_" + value);
            }
        }
        return names;
    }

    public double[][] transform(DataTable table) {
        Set<String> missing = new TreeSet<>();
        for (NumericColumn column : numericColumns) {
            if (!table.hasColumn(column.name())) missing.add(column.name());
        }
        for (CategoricalColumn column : categoricalColumns) {
            if (!table.hasColumn(column.name())) missing.add(column.name());
        }
        if (!missing.isEmpty()) {
            throw DetectorException.schema("Input is missing required columns: " + missing);
        }

        int width = getFeatureWidth();
        double[][] matrix = new double[table.size()][];
        for (int row = 0; row < table.size(); row++) {
            double[] vector = new double[width];
            int offset = 0;
            for (NumericColumn column : numericColumns) {
                vector[offset++] = column.transform(table.numeric(row, column.name()));
            }
            for (CategoricalColumn column : categoricalColumns) {
                column.encode(table.categorical(row, column.name()), vector, offset);
                offset += column.width();
            }
            matrix[row] = vector;
        }
        return matrix;
    }
}
