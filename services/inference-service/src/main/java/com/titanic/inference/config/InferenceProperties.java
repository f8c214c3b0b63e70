package com.titanic.inference.config;

import com.titanic.inference.model.ModelType;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "inference")
public class InferenceProperties {
    private String modelsDir = "models";
    private Map<String, ModelDefinition> models = new LinkedHashMap<>();
    private Duration modelLoadTimeout = Duration.ofSeconds(10);
    private int modelLoadPoolSize = 4;
    private Health health = new Health();

    public String getModelsDir() {
        return modelsDir;
    }

    public void setModelsDir(String modelsDir) {
        this.modelsDir = modelsDir;
    }

    public Map<String, ModelDefinition> getModels() {
        return models;
    }

    public void setModels(Map<String, ModelDefinition> models) {
        this.models = models;
    }

    public Duration getModelLoadTimeout() {
        return modelLoadTimeout;
    }

    public void setModelLoadTimeout(Duration modelLoadTimeout) {
        this.modelLoadTimeout = modelLoadTimeout;
    }

    public int getModelLoadPoolSize() {
        return modelLoadPoolSize;
    }

    public void setModelLoadPoolSize(int modelLoadPoolSize) {
        this.modelLoadPoolSize = modelLoadPoolSize;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public static class ModelDefinition {
        private ModelType type;
        private String artifact;

        public ModelDefinition() {
        }

        public ModelDefinition(ModelType type, String artifact) {
            this.type = type;
            this.artifact = artifact;
        }

        public ModelType getType() {
            return type;
        }

        public void setType(ModelType type) {
            this.type = type;
        }

        public String getArtifact() {
            return artifact;
        }

        public void setArtifact(String artifact) {
            this.artifact = artifact;
        }
    }

    public static class Health {
        private long minFreeMemoryMb = 32;
        private long minFreeDiskMb = 64;

        public long getMinFreeMemoryMb() {
            return minFreeMemoryMb;
        }

        public void setMinFreeMemoryMb(long minFreeMemoryMb) {
            this.minFreeMemoryMb = minFreeMemoryMb;
        }

        public long getMinFreeDiskMb() {
            return minFreeDiskMb;
        }

        public void setMinFreeDiskMb(long minFreeDiskMb) {
            this.minFreeDiskMb = minFreeDiskMb;
        }
    }
}
