package com.titanic.inference.features;

import java.util.List;

public record FeatureManifest(List<FeatureColumn> columns) {
    public FeatureManifest {
        columns = List.copyOf(columns);
    }

    public List<String> names() {
        return columns.stream().map(FeatureColumn::columnName).toList();
    }

    public int size() {
        return columns.size();
    }
}
