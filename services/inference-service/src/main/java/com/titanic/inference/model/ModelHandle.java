package com.titanic.inference.model;

import com.titanic.inference.features.FeatureVector;

/**
 * A loaded classifier. Instances are immutable and shared by every request.
 */
public interface ModelHandle {
    String key();

    ModelType type();

    double predictProbability(FeatureVector vector);

    ModelMetadata metadata();
}
