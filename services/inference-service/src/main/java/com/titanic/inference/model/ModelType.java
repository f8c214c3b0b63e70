package com.titanic.inference.model;

public enum ModelType {
    LOGISTIC_REGRESSION("logistic_regression"),
    DECISION_TREE("decision_tree");

    private final String wire;

    ModelType(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static ModelType from(String raw) {
        if (raw == null) {
            return null;
        }
        for (ModelType type : values()) {
            if (type.wire.equalsIgnoreCase(raw.trim()) || type.name().equalsIgnoreCase(raw.trim())) {
                return type;
            }
        }
        return null;
    }
}
