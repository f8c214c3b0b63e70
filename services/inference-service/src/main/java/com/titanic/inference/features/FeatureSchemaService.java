package com.titanic.inference.features;

import com.titanic.inference.artifact.ArtifactReadException;
import com.titanic.inference.artifact.ArtifactStore;
import com.titanic.inference.config.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class FeatureSchemaService {
    public static final String MANIFEST = "feature_columns.json";
    public static final String STATS = "preprocessing_stats.json";
    public static final String ENCODERS = "label_encoders.json";

    private static final Logger log = LoggerFactory.getLogger(FeatureSchemaService.class);

    private final ArtifactStore artifactStore;
    private FeatureSchema schema;

    public FeatureSchemaService(ArtifactStore artifactStore) {
        this.artifactStore = artifactStore;
    }

    @PostConstruct
    public void init() {
        FeatureManifest manifest;
        PreprocessingStats stats;
        try {
            manifest = FeatureSchemaValidator.manifest(artifactStore.read(MANIFEST, String[].class));
            stats = artifactStore.read(STATS, PreprocessingStats.class);
        } catch (ArtifactReadException ex) {
            throw new ConfigurationException(ex.getMessage(), ex);
        }

        LabelEncodings encodings;
        if (artifactStore.exists(ENCODERS)) {
            try {
                encodings = artifactStore.read(ENCODERS, LabelEncodings.class);
            } catch (ArtifactReadException ex) {
                throw new ConfigurationException(ex.getMessage(), ex);
            }
        } else {
            log.warn("label encoders not found, using defaults name={}", ENCODERS);
            encodings = LabelEncodings.defaults();
        }

        FeatureSchema loaded = new FeatureSchema(manifest, stats, encodings);
        FeatureSchemaValidator.validate(loaded);
        schema = loaded;
        log.info("feature schema loaded columns={} age_median={} fare_median={} embarked_mode={}",
            manifest.names(), stats.getAgeMedian(), stats.getFareMedian(), stats.getEmbarkedMode());
    }

    public FeatureSchema getSchema() {
        return schema;
    }
}
