package com.titanic.inference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.titanic.inference.artifact.FileSystemArtifactStore;
import com.titanic.inference.config.InferenceProperties;
import com.titanic.inference.config.InferenceProperties.ModelDefinition;
import com.titanic.inference.features.Embarked;
import com.titanic.inference.features.FeatureSchemaService;
import com.titanic.inference.features.PassengerFeatures;
import com.titanic.inference.features.Sex;
import com.titanic.inference.model.ModelCatalog;
import com.titanic.inference.model.ModelType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

public final class Fixtures {
    public static final Path MODELS_DIR = Path.of("src/test/resources/models");

    private Fixtures() {
    }

    public static PassengerFeatures firstClassWoman() {
        return new PassengerFeatures(1, Sex.FEMALE, 29.0, 0, 0, 211.34, Embarked.S);
    }

    public static PassengerFeatures thirdClassMan() {
        return new PassengerFeatures(3, Sex.MALE, 22.0, 1, 0, 7.25, Embarked.S);
    }

    public static FileSystemArtifactStore store() {
        return store(MODELS_DIR);
    }

    public static FileSystemArtifactStore store(Path dir) {
        return new FileSystemArtifactStore(dir, new ObjectMapper());
    }

    public static InferenceProperties properties() {
        InferenceProperties properties = new InferenceProperties();
        properties.setModelsDir(MODELS_DIR.toString());
        properties.getModels().put(
            "logistic_regression", new ModelDefinition(ModelType.LOGISTIC_REGRESSION, "logistic_model.json"));
        properties.getModels().put(
            "decision_tree", new ModelDefinition(ModelType.DECISION_TREE, "decision_tree_model.json"));
        return properties;
    }

    public static FeatureSchemaService schemaService(FileSystemArtifactStore store) {
        FeatureSchemaService service = new FeatureSchemaService(store);
        service.init();
        return service;
    }

    public static ModelCatalog catalog(FileSystemArtifactStore store, InferenceProperties properties) {
        ModelCatalog catalog = new ModelCatalog(store, properties);
        catalog.init();
        return catalog;
    }

    public static void copyModels(Path target) throws IOException {
        try (Stream<Path> files = Files.list(MODELS_DIR)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                Files.copy(file, target.resolve(file.getFileName()));
            }
        }
    }
}
