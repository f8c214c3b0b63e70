package com.titanic.inference.model;

import com.titanic.inference.artifact.ArtifactReadException;
import com.titanic.inference.artifact.ArtifactStore;
import com.titanic.inference.config.InferenceProperties;
import com.titanic.inference.config.InferenceProperties.ModelDefinition;
import jakarta.annotation.PostConstruct;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Static description of the configured models. Reading it never loads a model.
 */
@Component
public class ModelCatalog {
    public static final String EVALUATION_RESULTS = "evaluation_results.json";

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);

    private final ArtifactStore artifactStore;
    private final InferenceProperties properties;
    private EvaluationResults evaluation = EvaluationResults.empty();

    public ModelCatalog(ArtifactStore artifactStore, InferenceProperties properties) {
        this.artifactStore = artifactStore;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (!artifactStore.exists(EVALUATION_RESULTS)) {
            log.warn("evaluation results not found, accuracy metadata unavailable name={}", EVALUATION_RESULTS);
            return;
        }
        try {
            evaluation = artifactStore.read(EVALUATION_RESULTS, EvaluationResults.class);
        } catch (ArtifactReadException ex) {
            log.warn("evaluation results unreadable name={} error={}", EVALUATION_RESULTS, ex.getMessage());
        }
    }

    public List<String> keys() {
        return List.copyOf(properties.getModels().keySet());
    }

    public boolean contains(String key) {
        return properties.getModels().containsKey(key);
    }

    public ModelMetadata metadata(String key) {
        ModelDefinition definition = properties.getModels().get(key);
        if (definition == null) {
            return null;
        }
        return new ModelMetadata(
            key,
            definition.getType(),
            evaluation.accuracy(key),
            evaluation.getTrainingDate(),
            definition.getArtifact()
        );
    }

    public Double ensembleAccuracy() {
        return evaluation.ensembleAccuracy();
    }

    public String trainingDate() {
        return evaluation.getTrainingDate();
    }
}
