package com.titanic.inference.health;

import java.util.Locale;

public enum ServingState {
    STARTING,
    READY;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
