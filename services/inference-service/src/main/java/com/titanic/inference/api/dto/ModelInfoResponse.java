package com.titanic.inference.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelInfoResponse {
    private List<ModelInfo> models;

    @JsonProperty("models_loaded")
    private int modelsLoaded;

    @JsonProperty("ensemble_accuracy")
    private Double ensembleAccuracy;

    @JsonProperty("feature_columns")
    private List<String> featureColumns;

    @JsonProperty("loading_mode")
    private String loadingMode;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public List<ModelInfo> getModels() {
        return models;
    }

    public void setModels(List<ModelInfo> models) {
        this.models = models;
    }

    public int getModelsLoaded() {
        return modelsLoaded;
    }

    public void setModelsLoaded(int modelsLoaded) {
        this.modelsLoaded = modelsLoaded;
    }

    public Double getEnsembleAccuracy() {
        return ensembleAccuracy;
    }

    public void setEnsembleAccuracy(Double ensembleAccuracy) {
        this.ensembleAccuracy = ensembleAccuracy;
    }

    public List<String> getFeatureColumns() {
        return featureColumns;
    }

    public void setFeatureColumns(List<String> featureColumns) {
        this.featureColumns = featureColumns;
    }

    public String getLoadingMode() {
        return loadingMode;
    }

    public void setLoadingMode(String loadingMode) {
        this.loadingMode = loadingMode;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ModelInfo {
        private String name;
        private String type;
        private String artifact;
        private String status;
        private Double accuracy;

        @JsonProperty("training_date")
        private String trainingDate;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getArtifact() {
            return artifact;
        }

        public void setArtifact(String artifact) {
            this.artifact = artifact;
        }

        public String getStatus() {
            return status;
        }

        public void setStatus(String status) {
            this.status = status;
        }

        public Double getAccuracy() {
            return accuracy;
        }

        public void setAccuracy(Double accuracy) {
            this.accuracy = accuracy;
        }

        public String getTrainingDate() {
            return trainingDate;
        }

        public void setTrainingDate(String trainingDate) {
            this.trainingDate = trainingDate;
        }
    }
}
