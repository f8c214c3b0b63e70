package com.titanic.inference.model;

import com.titanic.inference.artifact.ArtifactReadException;
import com.titanic.inference.artifact.ArtifactStore;
import com.titanic.inference.features.FeatureSchemaService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ArtifactModelLoader implements ModelLoader {
    private static final Logger log = LoggerFactory.getLogger(ArtifactModelLoader.class);

    private final ArtifactStore artifactStore;
    private final ModelCatalog catalog;
    private final FeatureSchemaService schemaService;

    public ArtifactModelLoader(ArtifactStore artifactStore, ModelCatalog catalog, FeatureSchemaService schemaService) {
        this.artifactStore = artifactStore;
        this.catalog = catalog;
        this.schemaService = schemaService;
    }

    @Override
    public ModelHandle load(String key) {
        ModelMetadata metadata = catalog.metadata(key);
        if (metadata == null) {
            throw new ModelUnavailableException(key, "unknown model: " + key);
        }
        long started = System.nanoTime();
        try {
            ModelHandle handle = switch (metadata.type()) {
                case LOGISTIC_REGRESSION -> loadLogistic(metadata);
                case DECISION_TREE -> loadTree(metadata);
            };
            log.info("model loaded model={} type={} artifact={} took_ms={}",
                key, metadata.type().wire(), metadata.artifact(), (System.nanoTime() - started) / 1_000_000L);
            return handle;
        } catch (ArtifactReadException ex) {
            throw new ModelUnavailableException(key, "model artifact unavailable: " + ex.getMessage(), ex);
        }
    }

    private LogisticRegressionModel loadLogistic(ModelMetadata metadata) {
        LogisticModelArtifact artifact = artifactStore.read(metadata.artifact(), LogisticModelArtifact.class);
        checkModelType(metadata, artifact.getModelType());
        List<String> columns = checkColumns(metadata, artifact.getFeatureColumns());
        double[] coefficients = artifact.getCoefficients();
        if (coefficients == null || coefficients.length != columns.size()) {
            throw invalid(metadata, "coefficient count does not match feature columns");
        }
        if (artifact.getIntercept() == null) {
            throw invalid(metadata, "intercept missing");
        }
        for (double coefficient : coefficients) {
            if (!Double.isFinite(coefficient)) {
                throw invalid(metadata, "non-finite coefficient");
            }
        }
        return new LogisticRegressionModel(coefficients, artifact.getIntercept(), metadata);
    }

    private DecisionTreeModel loadTree(ModelMetadata metadata) {
        DecisionTreeArtifact artifact = artifactStore.read(metadata.artifact(), DecisionTreeArtifact.class);
        checkModelType(metadata, artifact.getModelType());
        List<String> columns = checkColumns(metadata, artifact.getFeatureColumns());
        List<DecisionTreeArtifact.Node> nodes = artifact.getNodes();
        if (nodes == null || nodes.isEmpty()) {
            throw invalid(metadata, "tree has no nodes");
        }

        int count = nodes.size();
        int[] feature = new int[count];
        double[] threshold = new double[count];
        int[] left = new int[count];
        int[] right = new int[count];
        double[] leafProbability = new double[count];
        for (int i = 0; i < count; i++) {
            DecisionTreeArtifact.Node node = nodes.get(i);
            if (node == null) {
                throw invalid(metadata, "node " + i + " missing");
            }
            boolean leaf = node.getLeft() == DecisionTreeModel.LEAF && node.getRight() == DecisionTreeModel.LEAF;
            if (leaf) {
                double[] value = node.getValue();
                if (value == null || value.length != 2 || value[0] < 0 || value[1] < 0 || value[0] + value[1] <= 0) {
                    throw invalid(metadata, "leaf " + i + " has invalid class counts");
                }
                leafProbability[i] = value[1] / (value[0] + value[1]);
            } else {
                if (node.getFeature() < 0 || node.getFeature() >= columns.size()) {
                    throw invalid(metadata, "node " + i + " references feature out of range");
                }
                if (!isChild(i, node.getLeft(), count) || !isChild(i, node.getRight(), count)) {
                    throw invalid(metadata, "node " + i + " references child out of range");
                }
                if (!Double.isFinite(node.getThreshold())) {
                    throw invalid(metadata, "node " + i + " has non-finite threshold");
                }
            }
            feature[i] = node.getFeature();
            threshold[i] = node.getThreshold();
            left[i] = leaf ? DecisionTreeModel.LEAF : node.getLeft();
            right[i] = leaf ? DecisionTreeModel.LEAF : node.getRight();
        }
        return new DecisionTreeModel(feature, threshold, left, right, leafProbability, metadata);
    }

    private static boolean isChild(int parent, int child, int count) {
        return child > parent && child < count;
    }

    private void checkModelType(ModelMetadata metadata, String declared) {
        if (declared != null && ModelType.from(declared) != metadata.type()) {
            throw invalid(metadata, "artifact declares model_type " + declared);
        }
    }

    private List<String> checkColumns(ModelMetadata metadata, List<String> declared) {
        List<String> expected = schemaService.getSchema().manifest().names();
        if (declared == null || !declared.equals(expected)) {
            throw invalid(metadata, "feature columns " + declared + " do not match manifest " + expected);
        }
        return expected;
    }

    private static ModelUnavailableException invalid(ModelMetadata metadata, String reason) {
        return new ModelUnavailableException(metadata.key(), "invalid model artifact " + metadata.artifact() + ": " + reason);
    }
}
