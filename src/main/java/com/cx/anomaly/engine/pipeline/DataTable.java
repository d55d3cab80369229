package com.cx.anomaly.engine.pipeline;

import com.cx.anomaly.engine.DetectorException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A raw, column-addressed table of interaction rows. Numeric cells may be numbers, numeric
 * strings or missing; categorical cells are strings or missing.
 */
public final class DataTable {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    public DataTable(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = List.copyOf(columns);
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public Object value(int row, String column) {
        return rows.get(row).get(column);
    }

    /**
     * Reads a numeric cell; missing and blank cells come back as NaN.
     */
    public double numeric(int row, String column) {
        return toDouble(value(row, column), column);
    }

    /**
     * Reads a categorical cell; missing and blank cells come back as null.
     */
    public String categorical(int row, String column) {
        Object value = value(row, column);
        if (value == null) return null;
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    public static double toDouble(Object value, String column) {
        if (value == null) return Double.NaN;
        if (value instanceof Number number) return number.doubleValue();
        if (value instanceof Boolean bool) return bool ? 1.0 : 0.0;
        String text = value.toString().trim();
        if (text.isEmpty()) return Double.NaN;
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw DetectorException.schema("Column '" + column + "' has non-numeric value: " + text);
        }
    }
}
