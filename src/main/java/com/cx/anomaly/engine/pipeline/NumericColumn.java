package com.cx.anomaly.engine.pipeline;

/**
 * Learned state for one numeric column: the value used for missing cells, then
 * {@code (value - center) / scale}.
 */
public record NumericColumn(String name, double fillValue, double center, double scale) {

    public double transform(double raw) {
        double value = Double.isNaN(raw) ? fillValue : raw;
        return (value - center) / scale;
    }
}
