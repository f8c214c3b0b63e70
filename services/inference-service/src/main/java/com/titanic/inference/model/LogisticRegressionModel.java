package com.titanic.inference.model;

import com.titanic.inference.features.FeatureVector;

public final class LogisticRegressionModel implements ModelHandle {
    private final double[] coefficients;
    private final double intercept;
    private final ModelMetadata metadata;

    public LogisticRegressionModel(double[] coefficients, double intercept, ModelMetadata metadata) {
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
        this.metadata = metadata;
    }

    @Override
    public String key() {
        return metadata.key();
    }

    @Override
    public ModelType type() {
        return ModelType.LOGISTIC_REGRESSION;
    }

    @Override
    public double predictProbability(FeatureVector vector) {
        if (vector.size() != coefficients.length) {
            throw new IllegalArgumentException(
                "expected " + coefficients.length + " features but got " + vector.size());
        }
        double z = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            z += coefficients[i] * vector.get(i);
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }

    @Override
    public ModelMetadata metadata() {
        return metadata;
    }
}
