package com.titanic.inference.features;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PreprocessingStats {
    @JsonProperty("age_median")
    private Double ageMedian;

    @JsonProperty("fare_median")
    private Double fareMedian;

    @JsonProperty("embarked_mode")
    private String embarkedMode;

    public PreprocessingStats() {
    }

    public PreprocessingStats(Double ageMedian, Double fareMedian, String embarkedMode) {
        this.ageMedian = ageMedian;
        this.fareMedian = fareMedian;
        this.embarkedMode = embarkedMode;
    }

    public Double getAgeMedian() {
        return ageMedian;
    }

    public void setAgeMedian(Double ageMedian) {
        this.ageMedian = ageMedian;
    }

    public Double getFareMedian() {
        return fareMedian;
    }

    public void setFareMedian(Double fareMedian) {
        this.fareMedian = fareMedian;
    }

    public String getEmbarkedMode() {
        return embarkedMode;
    }

    public void setEmbarkedMode(String embarkedMode) {
        this.embarkedMode = embarkedMode;
    }
}
