package com.titanic.inference.features;

import com.titanic.inference.config.ConfigurationException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class FeatureSchemaValidator {
    private FeatureSchemaValidator() {}

    public static FeatureManifest manifest(String[] rawColumns) {
        if (rawColumns == null || rawColumns.length == 0) {
            throw new ConfigurationException("feature manifest empty");
        }
        Set<FeatureColumn> seen = new HashSet<>();
        List<FeatureColumn> columns = new ArrayList<>();
        for (String raw : rawColumns) {
            FeatureColumn column = FeatureColumn.from(raw);
            if (column == null) {
                throw new ConfigurationException("unknown feature column: " + raw);
            }
            if (!seen.add(column)) {
                throw new ConfigurationException("duplicate feature column: " + raw);
            }
            columns.add(column);
        }
        return new FeatureManifest(columns);
    }

    public static void validate(FeatureSchema schema) {
        PreprocessingStats stats = schema.stats();
        if (stats == null) {
            throw new ConfigurationException("preprocessing stats missing");
        }
        if (stats.getAgeMedian() == null || !Double.isFinite(stats.getAgeMedian())) {
            throw new ConfigurationException("preprocessing stats missing age_median");
        }
        if (stats.getFareMedian() == null || !Double.isFinite(stats.getFareMedian())) {
            throw new ConfigurationException("preprocessing stats missing fare_median");
        }
        if (Embarked.from(stats.getEmbarkedMode()) == null) {
            throw new ConfigurationException("preprocessing stats missing embarked_mode");
        }

        LabelEncodings encodings = schema.encodings();
        for (Sex sex : Sex.values()) {
            if (encodings.getSex() == null || encodings.encodeSex(sex) < 0) {
                throw new ConfigurationException("label encoder for sex lacks class: " + sex.wire());
            }
        }
        for (Embarked embarked : Embarked.values()) {
            if (encodings.getEmbarked() == null || encodings.encodeEmbarked(embarked) < 0) {
                throw new ConfigurationException("label encoder for embarked lacks class: " + embarked.wire());
            }
        }
    }
}
