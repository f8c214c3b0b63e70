package com.titanic.inference.prediction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record EnsembleResult(Map<String, ModelPrediction> perModel, Ensemble ensemble) {
    public EnsembleResult {
        perModel = Collections.unmodifiableMap(new LinkedHashMap<>(perModel));
    }

    public static EnsembleResult combine(Map<String, ModelPrediction> perModel) {
        if (perModel.isEmpty()) {
            throw new IllegalArgumentException("ensemble needs at least one model");
        }
        double sum = 0;
        for (ModelPrediction prediction : perModel.values()) {
            sum += prediction.probability();
        }
        double probability = sum / perModel.size();
        double confidence = ConfidenceLevel.confidence(probability);
        return new EnsembleResult(perModel, new Ensemble(
            probability,
            ModelPrediction.labelFor(probability),
            confidence,
            ConfidenceLevel.from(confidence)
        ));
    }

    public record Ensemble(double probability, String label, double confidence, ConfidenceLevel confidenceLevel) {
    }
}
