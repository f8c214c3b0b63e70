package com.titanic.inference.features;

import java.util.Arrays;
import java.util.List;

public final class FeatureVector {
    private final List<String> columns;
    private final double[] values;

    public FeatureVector(List<String> columns, double[] values) {
        if (columns.size() != values.length) {
            throw new IllegalArgumentException("columns and values differ in length");
        }
        this.columns = List.copyOf(columns);
        this.values = values.clone();
    }

    public List<String> columns() {
        return columns;
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double get(String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("unknown column: " + column);
        }
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FeatureVector that)) {
            return false;
        }
        return columns.equals(that.columns) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * columns.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + columns + Arrays.toString(values);
    }
}
