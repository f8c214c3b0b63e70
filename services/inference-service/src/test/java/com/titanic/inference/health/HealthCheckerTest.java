package com.titanic.inference.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.titanic.inference.Fixtures;
import com.titanic.inference.artifact.FileSystemArtifactStore;
import com.titanic.inference.config.ConfigurationValidator;
import com.titanic.inference.config.InferenceProperties;
import com.titanic.inference.model.ModelCache;
import com.titanic.inference.model.ModelCache.LoadFailure;
import com.titanic.inference.model.ModelStatus;
import com.titanic.inference.ratelimit.RateLimitProperties;
import com.titanic.inference.security.JwtProperties;
import com.titanic.inference.security.TestTokens;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HealthCheckerTest {
    private static final long GB = 1024L * 1024L * 1024L;

    @Mock
    private ModelCache modelCache;

    @TempDir
    Path tempDir;

    @Test
    void fastPathNeverTouchesModels() {
        HealthChecker checker = checker(Fixtures.store(), new FixedProbe(GB, GB));
        checker.markReady();

        HealthReport report = checker.check(false);

        assertThat(report.status()).isEqualTo("ok");
        assertThat(report.state()).isEqualTo(ServingState.READY);
        assertThat(report.checks()).isNull();
        verifyNoInteractions(modelCache);
    }

    @Test
    void reportsStartingUntilReady() {
        HealthChecker checker = checker(Fixtures.store(), new FixedProbe(GB, GB));

        assertThat(checker.check(false).status()).isEqualTo("starting");
        assertThat(checker.state()).isEqualTo(ServingState.STARTING);

        checker.markReady();

        assertThat(checker.check(false).status()).isEqualTo("ok");
    }

    @Test
    void detailedCheckIsOkWhenEverythingIsHealthy() {
        when(modelCache.status(anyString())).thenReturn(ModelStatus.NOT_LOADED);
        HealthChecker checker = checker(Fixtures.store(), new FixedProbe(GB, GB));
        checker.markReady();

        HealthReport report = checker.check(true);

        assertThat(report.status()).isEqualTo("ok");
        assertThat(report.checks()).containsOnlyKeys("models", "model_files", "resources", "configuration");
        assertThat(report.checks().values()).allMatch(CheckResult::isOk);
    }

    @Test
    void lowMemoryDegradesWithoutLeavingReadyState() {
        HealthChecker checker = checker(Fixtures.store(), new FixedProbe(0L, GB));
        checker.markReady();

        CheckResult resources = checker.checkResources();

        assertThat(resources.status()).isEqualTo("degraded");
        assertThat(resources.message()).contains("free memory below threshold");
        when(modelCache.status(anyString())).thenReturn(ModelStatus.LOADED);
        HealthReport report = checker.check(true);
        assertThat(report.status()).isEqualTo("degraded");
        assertThat(report.state()).isEqualTo(ServingState.READY);
    }

    @Test
    void unreadableDiskIsReported() {
        HealthChecker checker = checker(Fixtures.store(), new FixedProbe(GB, -1L));

        assertThat(checker.checkResources().message()).contains("free disk space unknown");
    }

    @Test
    void failedModelIsDegraded() {
        when(modelCache.status("logistic_regression")).thenReturn(ModelStatus.LOADED);
        when(modelCache.status("decision_tree")).thenReturn(ModelStatus.FAILED);
        when(modelCache.lastFailure("logistic_regression")).thenReturn(Optional.empty());
        when(modelCache.lastFailure("decision_tree"))
            .thenReturn(Optional.of(new LoadFailure("artifact unreadable", Instant.parse("2026-03-01T12:00:00Z"))));
        HealthChecker checker = checker(Fixtures.store(), new FixedProbe(GB, GB));

        CheckResult models = checker.checkModels();

        assertThat(models.status()).isEqualTo("degraded");
        assertThat(models.message()).contains("decision_tree failed to load");
        assertThat(models.details()).containsKey("decision_tree");
    }

    @Test
    void lowAccuracyIsDegraded() throws IOException {
        Fixtures.copyModels(tempDir);
        Files.writeString(
            tempDir.resolve("evaluation_results.json"),
            "{\"logistic_regression_accuracy\": 0.65, \"decision_tree_accuracy\": 0.82}"
        );
        when(modelCache.status(anyString())).thenReturn(ModelStatus.NOT_LOADED);
        HealthChecker checker = checker(Fixtures.store(tempDir), new FixedProbe(GB, GB));

        CheckResult models = checker.checkModels();

        assertThat(models.status()).isEqualTo("degraded");
        assertThat(models.message()).isEqualTo("logistic_regression accuracy below 0.7");
    }

    @Test
    void missingArtifactIsDegraded() throws IOException {
        Fixtures.copyModels(tempDir);
        Files.delete(tempDir.resolve("decision_tree_model.json"));
        HealthChecker checker = checker(Fixtures.store(tempDir), new FixedProbe(GB, GB));

        CheckResult files = checker.checkModelFiles();

        assertThat(files.status()).isEqualTo("degraded");
        assertThat(files.message()).contains("decision_tree_model.json");
    }

    private HealthChecker checker(FileSystemArtifactStore store, ResourceProbe probe) {
        InferenceProperties properties = Fixtures.properties();
        JwtProperties jwt = new JwtProperties();
        jwt.setIssuer(TestTokens.ISSUER);
        jwt.setAudience(TestTokens.AUDIENCE);
        jwt.setPublicKey(TestTokens.publicKeyPem());
        ConfigurationValidator validator = new ConfigurationValidator(properties, jwt, new RateLimitProperties(), store);
        return new HealthChecker(
            modelCache,
            Fixtures.catalog(store, properties),
            store,
            Fixtures.schemaService(store),
            validator,
            probe,
            properties
        );
    }

    private static final class FixedProbe implements ResourceProbe {
        private final long memory;
        private final long disk;

        FixedProbe(long memory, long disk) {
            this.memory = memory;
            this.disk = disk;
        }

        @Override
        public long freeMemoryBytes() {
            return memory;
        }

        @Override
        public long freeDiskBytes(Path path) {
            return disk;
        }
    }
}
