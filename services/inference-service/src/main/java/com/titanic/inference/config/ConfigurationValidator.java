package com.titanic.inference.config;

import com.titanic.inference.artifact.ArtifactStore;
import com.titanic.inference.ratelimit.RateLimitBackend;
import com.titanic.inference.ratelimit.RateLimitProperties;
import com.titanic.inference.security.JwtProperties;
import com.titanic.inference.security.PemKeys;
import jakarta.annotation.PostConstruct;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks the bound configuration once at startup. Any problem is fatal: the
 * context refuses to start rather than serve with a broken setup.
 */
@Component
public class ConfigurationValidator {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationValidator.class);

    private final InferenceProperties properties;
    private final JwtProperties jwtProperties;
    private final RateLimitProperties rateLimitProperties;
    private final ArtifactStore artifactStore;

    public ConfigurationValidator(
        InferenceProperties properties,
        JwtProperties jwtProperties,
        RateLimitProperties rateLimitProperties,
        ArtifactStore artifactStore
    ) {
        this.properties = properties;
        this.jwtProperties = jwtProperties;
        this.rateLimitProperties = rateLimitProperties;
        this.artifactStore = artifactStore;
    }

    @PostConstruct
    public void init() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            log.error("configuration invalid problems={}", problems);
            throw new ConfigurationException("invalid configuration: " + String.join("; ", problems));
        }
        log.info(
            "configuration validated models_dir={} models={} rate_limit_backend={}",
            artifactStore.root(),
            properties.getModels().keySet(),
            rateLimitProperties.getBackend()
        );
    }

    public List<String> validate() {
        List<String> problems = new ArrayList<>();

        Path root = artifactStore.root();
        if (!Files.isDirectory(root)) {
            problems.add("models_dir is not a directory: " + root);
        }
        if (properties.getModels().isEmpty()) {
            problems.add("no models configured");
        }
        properties.getModels().forEach((key, definition) -> {
            if (definition == null || definition.getType() == null) {
                problems.add("model type required: " + key);
            }
            if (definition == null || isBlank(definition.getArtifact())) {
                problems.add("model artifact required: " + key);
            }
        });
        if (properties.getModelLoadTimeout() == null || properties.getModelLoadTimeout().isNegative()
            || properties.getModelLoadTimeout().isZero()) {
            problems.add("model_load_timeout must be positive");
        }

        if (isBlank(jwtProperties.getIssuer())) {
            problems.add("jwt issuer required");
        }
        if (isBlank(jwtProperties.getAudience())) {
            problems.add("jwt audience required");
        }
        if (isBlank(jwtProperties.getPublicKey())) {
            problems.add("jwt public key required");
        } else {
            try {
                PemKeys.parseRsaPublicKey(jwtProperties.getPublicKey());
            } catch (ConfigurationException ex) {
                problems.add(ex.getMessage());
            }
        }
        if (jwtProperties.getClockSkew() != null && jwtProperties.getClockSkew().isNegative()) {
            problems.add("jwt clock skew must not be negative");
        }

        if (RateLimitBackend.from(rateLimitProperties.getBackend()) == null) {
            problems.add("unknown rate limit backend: " + rateLimitProperties.getBackend());
        }
        if (rateLimitProperties.getWindow() == null || rateLimitProperties.getWindow().isNegative()
            || rateLimitProperties.getWindow().isZero()) {
            problems.add("rate limit window must be positive");
        }
        if (rateLimitProperties.getMaxRequests() <= 0) {
            problems.add("rate limit max must be positive");
        }
        rateLimitProperties.getEndpointLimits().forEach((endpoint, limit) -> {
            if (limit == null || limit <= 0) {
                problems.add("rate limit for endpoint must be positive: " + endpoint);
            }
        });
        return problems;
    }

    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("models_dir", artifactStore.root().toString());
        summary.put("models", List.copyOf(properties.getModels().keySet()));
        summary.put("jwt_issuer", jwtProperties.getIssuer());
        summary.put("jwt_audience", jwtProperties.getAudience());
        summary.put("rate_limit_enabled", rateLimitProperties.isEnabled());
        summary.put("rate_limit_backend", rateLimitProperties.getBackend());
        summary.put("rate_limit_window_seconds", rateLimitProperties.getWindow().toSeconds());
        summary.put("rate_limit_max", rateLimitProperties.getMaxRequests());
        return summary;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
