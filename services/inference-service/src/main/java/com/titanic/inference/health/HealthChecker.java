package com.titanic.inference.health;

import com.titanic.inference.artifact.ArtifactInfo;
import com.titanic.inference.artifact.ArtifactStore;
import com.titanic.inference.config.ConfigurationValidator;
import com.titanic.inference.config.InferenceProperties;
import com.titanic.inference.features.FeatureSchema;
import com.titanic.inference.features.FeatureSchemaService;
import com.titanic.inference.model.ModelCache;
import com.titanic.inference.model.ModelCatalog;
import com.titanic.inference.model.ModelMetadata;
import com.titanic.inference.model.ModelStatus;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class HealthChecker {
    static final double MIN_ACCURACY = 0.7;
    private static final long MB = 1024L * 1024L;

    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

    private final ModelCache modelCache;
    private final ModelCatalog catalog;
    private final ArtifactStore artifactStore;
    private final FeatureSchemaService schemaService;
    private final ConfigurationValidator configurationValidator;
    private final ResourceProbe resourceProbe;
    private final InferenceProperties properties;
    private volatile ServingState state = ServingState.STARTING;

    public HealthChecker(
        ModelCache modelCache,
        ModelCatalog catalog,
        ArtifactStore artifactStore,
        FeatureSchemaService schemaService,
        ConfigurationValidator configurationValidator,
        ResourceProbe resourceProbe,
        InferenceProperties properties
    ) {
        this.modelCache = modelCache;
        this.catalog = catalog;
        this.artifactStore = artifactStore;
        this.schemaService = schemaService;
        this.configurationValidator = configurationValidator;
        this.resourceProbe = resourceProbe;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void markReady() {
        state = ServingState.READY;
        log.info("serving state changed state={}", state.wire());
    }

    public ServingState state() {
        return state;
    }

    public HealthReport check(boolean detailed) {
        ServingState current = state;
        if (!detailed) {
            return new HealthReport(baseStatus(current), current, null);
        }

        Map<String, CheckResult> checks = new LinkedHashMap<>();
        checks.put("models", checkModels());
        checks.put("model_files", checkModelFiles());
        checks.put("resources", checkResources());
        checks.put("configuration", checkConfiguration());

        String status = baseStatus(current);
        if (current == ServingState.READY && checks.values().stream().anyMatch(check -> !check.isOk())) {
            status = CheckResult.DEGRADED;
        }
        return new HealthReport(status, current, checks);
    }

    private static String baseStatus(ServingState current) {
        return current == ServingState.READY ? CheckResult.OK : ServingState.STARTING.wire();
    }

    CheckResult checkModels() {
        Map<String, Object> details = new LinkedHashMap<>();
        List<String> problems = new ArrayList<>();
        for (String key : catalog.keys()) {
            ModelStatus status = modelCache.status(key);
            ModelMetadata metadata = catalog.metadata(key);
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("status", status.wire());
            model.put("accuracy", metadata.accuracy());
            modelCache.lastFailure(key).ifPresent(failure -> {
                model.put("last_failure", failure.message());
                model.put("last_failure_at", failure.failedAt().toString());
            });
            if (status == ModelStatus.FAILED) {
                problems.add(key + " failed to load");
            }
            if (metadata.accuracy() != null && metadata.accuracy() < MIN_ACCURACY) {
                problems.add(key + " accuracy below " + MIN_ACCURACY);
            }
            details.put(key, model);
        }
        if (!problems.isEmpty()) {
            return CheckResult.degraded(String.join("; ", problems), details);
        }
        return CheckResult.ok("models are loaded lazily on first use", details);
    }

    CheckResult checkModelFiles() {
        List<String> required = new ArrayList<>();
        required.add(FeatureSchemaService.MANIFEST);
        required.add(FeatureSchemaService.STATS);
        properties.getModels().values().forEach(definition -> required.add(definition.getArtifact()));

        Map<String, Object> details = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String name : required) {
            ArtifactInfo info = artifactStore.describe(name);
            details.put(name, describe(info));
            if (!info.exists()) {
                missing.add(name);
            }
        }
        for (String name : List.of(FeatureSchemaService.ENCODERS, ModelCatalog.EVALUATION_RESULTS)) {
            details.put(name, describe(artifactStore.describe(name)));
        }
        if (!missing.isEmpty()) {
            return CheckResult.degraded("missing required artifacts: " + missing, details);
        }
        return CheckResult.ok("all required artifacts present", details);
    }

    CheckResult checkResources() {
        InferenceProperties.Health thresholds = properties.getHealth();
        long freeMemoryMb = resourceProbe.freeMemoryBytes() / MB;
        long freeDiskBytes = resourceProbe.freeDiskBytes(artifactStore.root());
        long freeDiskMb = freeDiskBytes < 0 ? -1L : freeDiskBytes / MB;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("free_memory_mb", freeMemoryMb);
        details.put("min_free_memory_mb", thresholds.getMinFreeMemoryMb());
        details.put("free_disk_mb", freeDiskMb);
        details.put("min_free_disk_mb", thresholds.getMinFreeDiskMb());

        List<String> problems = new ArrayList<>();
        if (freeMemoryMb < thresholds.getMinFreeMemoryMb()) {
            problems.add("free memory below threshold");
        }
        if (freeDiskMb < 0) {
            problems.add("free disk space unknown");
        } else if (freeDiskMb < thresholds.getMinFreeDiskMb()) {
            problems.add("free disk space below threshold");
        }
        if (!problems.isEmpty()) {
            return CheckResult.degraded(String.join("; ", problems), details);
        }
        return CheckResult.ok("resources within thresholds", details);
    }

    CheckResult checkConfiguration() {
        Map<String, Object> details = new LinkedHashMap<>(configurationValidator.summary());
        FeatureSchema schema = schemaService.getSchema();
        details.put("feature_columns", schema == null ? 0 : schema.manifest().size());
        List<String> problems = configurationValidator.validate();
        if (!problems.isEmpty()) {
            details.put("problems", problems);
            return CheckResult.degraded("configuration problems detected", details);
        }
        return CheckResult.ok("configuration valid", details);
    }

    private static Map<String, Object> describe(ArtifactInfo info) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exists", info.exists());
        if (info.exists()) {
            details.put("size_bytes", info.sizeBytes());
            details.put("modified_at", info.lastModified() == null ? null : info.lastModified().toString());
        }
        return details;
    }
}
