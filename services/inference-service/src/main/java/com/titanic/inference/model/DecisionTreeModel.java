package com.titanic.inference.model;

import com.titanic.inference.features.FeatureVector;

/**
 * Binary classification tree stored as flat node arrays. A node is a leaf when
 * both children are {@value #LEAF}; otherwise {@code x[feature] <= threshold}
 * goes left.
 */
public final class DecisionTreeModel implements ModelHandle {
    public static final int LEAF = -1;

    private final int[] feature;
    private final double[] threshold;
    private final int[] left;
    private final int[] right;
    private final double[] leafProbability;
    private final ModelMetadata metadata;

    public DecisionTreeModel(
        int[] feature,
        double[] threshold,
        int[] left,
        int[] right,
        double[] leafProbability,
        ModelMetadata metadata
    ) {
        this.feature = feature.clone();
        this.threshold = threshold.clone();
        this.left = left.clone();
        this.right = right.clone();
        this.leafProbability = leafProbability.clone();
        this.metadata = metadata;
    }

    @Override
    public String key() {
        return metadata.key();
    }

    @Override
    public ModelType type() {
        return ModelType.DECISION_TREE;
    }

    @Override
    public double predictProbability(FeatureVector vector) {
        int node = 0;
        // children always sit after their parent, so this terminates within nodeCount steps
        while (left[node] != LEAF) {
            node = vector.get(feature[node]) <= threshold[node] ? left[node] : right[node];
        }
        return leafProbability[node];
    }

    @Override
    public ModelMetadata metadata() {
        return metadata;
    }

    public int nodeCount() {
        return feature.length;
    }
}
