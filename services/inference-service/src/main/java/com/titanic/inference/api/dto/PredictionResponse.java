package com.titanic.inference.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.titanic.inference.prediction.EnsembleResult;
import com.titanic.inference.prediction.ModelPrediction;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class PredictionResponse {
    @JsonProperty("per_model")
    private Map<String, ModelPrediction> perModel;

    private Ensemble ensemble;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public static PredictionResponse from(EnsembleResult result) {
        PredictionResponse response = new PredictionResponse();
        response.setPerModel(new LinkedHashMap<>(result.perModel()));
        EnsembleResult.Ensemble source = result.ensemble();
        Ensemble ensemble = new Ensemble();
        ensemble.setProbability(source.probability());
        ensemble.setLabel(source.label());
        ensemble.setConfidence(source.confidence());
        ensemble.setConfidenceLevel(source.confidenceLevel().wire());
        response.setEnsemble(ensemble);
        return response;
    }

    public Map<String, ModelPrediction> getPerModel() {
        return perModel;
    }

    public void setPerModel(Map<String, ModelPrediction> perModel) {
        this.perModel = perModel;
    }

    public Ensemble getEnsemble() {
        return ensemble;
    }

    public void setEnsemble(Ensemble ensemble) {
        this.ensemble = ensemble;
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

    public static class Ensemble {
        private double probability;
        private String label;
        private double confidence;

        @JsonProperty("confidence_level")
        private String confidenceLevel;

        public double getProbability() {
            return probability;
        }

        public void setProbability(double probability) {
            this.probability = probability;
        }

        public String getLabel() {
            return label;
        }

        public void setLabel(String label) {
            this.label = label;
        }

        public double getConfidence() {
            return confidence;
        }

        public void setConfidence(double confidence) {
            this.confidence = confidence;
        }

        public String getConfidenceLevel() {
            return confidenceLevel;
        }

        public void setConfidenceLevel(String confidenceLevel) {
            this.confidenceLevel = confidenceLevel;
        }
    }
}
