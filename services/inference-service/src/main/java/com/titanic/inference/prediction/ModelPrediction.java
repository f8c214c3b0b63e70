package com.titanic.inference.prediction;

public record ModelPrediction(double probability, String label) {
    public static final String SURVIVED = "survived";
    public static final String DIED = "died";

    public static ModelPrediction of(double probability) {
        return new ModelPrediction(probability, labelFor(probability));
    }

    public static String labelFor(double probability) {
        return probability >= 0.5 ? SURVIVED : DIED;
    }
}
