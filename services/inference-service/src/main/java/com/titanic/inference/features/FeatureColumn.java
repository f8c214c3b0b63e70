package com.titanic.inference.features;

public enum FeatureColumn {
    PCLASS("pclass"),
    SEX("sex"),
    AGE("age"),
    SIBSP("sibsp"),
    PARCH("parch"),
    FARE("fare"),
    EMBARKED("embarked"),
    FAMILY_SIZE("family_size"),
    IS_ALONE("is_alone"),
    AGE_GROUP("age_group");

    private final String columnName;

    FeatureColumn(String columnName) {
        this.columnName = columnName;
    }

    public String columnName() {
        return columnName;
    }

    public static FeatureColumn from(String raw) {
        if (raw == null) {
            return null;
        }
        for (FeatureColumn column : values()) {
            if (column.columnName.equals(raw.trim())) {
                return column;
            }
        }
        return null;
    }
}
