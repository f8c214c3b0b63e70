package com.titanic.inference.model;

public class ModelUnavailableException extends RuntimeException {
    private final String modelKey;

    public ModelUnavailableException(String modelKey, String message) {
        super(message);
        this.modelKey = modelKey;
    }

    public ModelUnavailableException(String modelKey, String message, Throwable cause) {
        super(message, cause);
        this.modelKey = modelKey;
    }

    public String getModelKey() {
        return modelKey;
    }
}
