package com.cx.anomaly.engine.pipeline;

import com.cx.anomaly.engine.DetectorException;
import com.cx.anomaly.engine.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

/**
 * Turns raw interaction tables into fixed-width numeric matrices.
 *
 * Numeric columns: missing cells are imputed with a fitted statistic, then scaled.
 * Categorical columns: missing cells become the {@code "missing"} category, then the value is
 * one-hot encoded against the vocabulary observed at fit time. Unseen values encode as all zeros.
 */
public class FeaturePipeline {

    private static final Logger log = LoggerFactory.getLogger(FeaturePipeline.class);

    private final FeatureSpec spec;
    private final ImputationStrategy imputationStrategy;
    private final double constantFillValue;
    private final ScalingMethod scalingMethod;

    private volatile FittedPipeline fitted;

    public FeaturePipeline(FeatureSpec spec, ImputationStrategy imputationStrategy,
                           double constantFillValue, ScalingMethod scalingMethod) {
        this.spec = spec;
        this.imputationStrategy = imputationStrategy;
        this.constantFillValue = constantFillValue;
        this.scalingMethod = scalingMethod;
    }

    public FittedPipeline fit(DataTable table) {
        spec.validate(table);
        if (table.size() == 0) {
            throw DetectorException.schema("Cannot fit the feature pipeline on an empty table");
        }

        List<NumericColumn> numericColumns = new ArrayList<>();
        for (String name : spec.numericFeatures()) {
            numericColumns.add(fitNumeric(table, name));
        }

        List<CategoricalColumn> categoricalColumns = new ArrayList<>();
        for (String name : spec.categoricalFeatures()) {
            TreeSet<String> vocabulary = new TreeSet<>();
            for (int row = 0; row < table.size(); row++) {
                String value = table.categorical(row, name);
                vocabulary.add(value == null ? CategoricalColumn.MISSING : value);
            }
            categoricalColumns.add(new CategoricalColumn(name, new ArrayList<>(vocabulary)));
        }

        FittedPipeline result = new FittedPipeline(numericColumns, categoricalColumns);
        log.info("Fitted feature pipeline on {} rows: {} numeric, {} categorical -> {} features",
                table.size(), numericColumns.size(), categoricalColumns.size(), result.getFeatureWidth());
        this.fitted = result;
        return result;
    }

    /**
     * Transforms with the state learned by the last {@link #fit}. Never changes that state.
     */
    public double[][] transform(DataTable table) {
        FittedPipeline current = fitted;
        if (current == null) {
            throw new DetectorException(ErrorKind.NOT_FITTED, "Feature pipeline has not been fitted");
        }
        return transform(current, table);
    }

    public static double[][] transform(FittedPipeline pipeline, DataTable table) {
        if (pipeline == null) {
            throw new DetectorException(ErrorKind.NOT_FITTED, "Feature pipeline has not been fitted");
        }
        return pipeline.transform(table);
    }

    public FittedPipeline getFitted() {
        return fitted;
    }

    private NumericColumn fitNumeric(DataTable table, String name) {
        double[] observed = new double[table.size()];
        int count = 0;
        for (int row = 0; row < table.size(); row++) {
            double value = table.numeric(row, name);
            if (!Double.isNaN(value)) observed[count++] = value;
        }
        observed = Arrays.copyOf(observed, count);

        double fill = fillValue(name, observed);

        // statistics are taken over the imputed column
        double[] imputed = new double[table.size()];
        for (int row = 0; row < table.size(); row++) {
            double value = table.numeric(row, name);
            imputed[row] = Double.isNaN(value) ? fill : value;
        }

        double center;
        double scale;
        if (scalingMethod == ScalingMethod.MINMAX) {
            double min = Arrays.stream(imputed).min().orElse(0.0);
            double max = Arrays.stream(imputed).max().orElse(0.0);
            center = min;
            scale = max - min;
        } else {
            double mean = Arrays.stream(imputed).average().orElse(0.0);
            double sumSq = 0.0;
            for (double v : imputed) sumSq += (v - mean) * (v - mean);
            center = mean;
            scale = Math.sqrt(sumSq / imputed.length);
        }
        if (scale == 0.0 || Double.isNaN(scale)) {
            scale = 1.0;
        }
        return new NumericColumn(name, fill, center, scale);
    }

    private double fillValue(String name, double[] observed) {
        if (imputationStrategy == ImputationStrategy.CONSTANT) {
            return constantFillValue;
        }
        if (observed.length == 0) {
            log.warn("Column '{}' has no observed values; imputing {}", name, constantFillValue);
            return constantFillValue;
        }
        if (imputationStrategy == ImputationStrategy.MEDIAN) {
            double[] sorted = observed.clone();
            Arrays.sort(sorted);
            int mid = sorted.length / 2;
            return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
        return Arrays.stream(observed).average().orElse(constantFillValue);
    }
}
