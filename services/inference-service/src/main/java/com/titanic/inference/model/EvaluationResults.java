package com.titanic.inference.model;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

public class EvaluationResults {
    private static final String ACCURACY_SUFFIX = "_accuracy";

    @JsonProperty("training_date")
    private String trainingDate;

    private final Map<String, Double> accuracies = new LinkedHashMap<>();

    public static EvaluationResults empty() {
        return new EvaluationResults();
    }

    @JsonAnySetter
    public void put(String name, Object value) {
        if (name.endsWith(ACCURACY_SUFFIX) && value instanceof Number number) {
            accuracies.put(name.substring(0, name.length() - ACCURACY_SUFFIX.length()), number.doubleValue());
        }
    }

    public Double accuracy(String modelKey) {
        return accuracies.get(modelKey);
    }

    public Double ensembleAccuracy() {
        return accuracies.get("ensemble");
    }

    public String getTrainingDate() {
        return trainingDate;
    }

    public void setTrainingDate(String trainingDate) {
        this.trainingDate = trainingDate;
    }
}
