package com.titanic.inference.features;

import java.util.Locale;

public enum Sex {
    MALE("male"),
    FEMALE("female");

    private final String wire;

    Sex(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static Sex from(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Sex value : values()) {
            if (value.wire.equals(normalized)) {
                return value;
            }
        }
        return null;
    }
}
