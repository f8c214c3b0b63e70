package com.titanic.inference.prediction;

import java.util.Locale;

public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static final double MEDIUM_FROM = 0.4;
    public static final double HIGH_FROM = 0.8;

    private static final double SCALE = 1e9;

    /**
     * Buckets a confidence in [0, 1]: below 0.4 is low, below 0.8 is medium,
     * anything else is high.
     */
    public static ConfidenceLevel from(double confidence) {
        if (confidence < MEDIUM_FROM) {
            return LOW;
        }
        if (confidence < HIGH_FROM) {
            return MEDIUM;
        }
        return HIGH;
    }

    /**
     * Distance from the decision boundary scaled to [0, 1], rounded to nine
     * decimals so that probabilities mirrored around 0.5 land in the same bucket.
     */
    public static double confidence(double probability) {
        return Math.round(Math.abs(probability - 0.5) * 2 * SCALE) / SCALE;
    }

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
