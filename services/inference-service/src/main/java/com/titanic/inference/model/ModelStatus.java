package com.titanic.inference.model;

import java.util.Locale;

public enum ModelStatus {
    NOT_LOADED,
    LOADING,
    LOADED,
    FAILED;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
