package com.titanic.inference.model;

public record ModelMetadata(String key, ModelType type, Double accuracy, String trainingDate, String artifact) {
}
