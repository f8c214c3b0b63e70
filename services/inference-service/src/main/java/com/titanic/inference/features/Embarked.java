package com.titanic.inference.features;

import java.util.Locale;

public enum Embarked {
    C,
    Q,
    S;

    public String wire() {
        return name();
    }

    public static Embarked from(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Embarked value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        return null;
    }
}
