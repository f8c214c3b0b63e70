package com.titanic.inference.prediction;

import com.titanic.inference.config.InferenceProperties;
import com.titanic.inference.features.FeatureTransformer;
import com.titanic.inference.features.FeatureVector;
import com.titanic.inference.features.PassengerFeatures;
import com.titanic.inference.features.TransformException;
import com.titanic.inference.model.ModelCache;
import com.titanic.inference.model.ModelCatalog;
import com.titanic.inference.model.ModelHandle;
import com.titanic.inference.model.ModelUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class PredictionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PredictionOrchestrator.class);

    private final FeatureTransformer transformer;
    private final ModelCache modelCache;
    private final ModelCatalog catalog;
    private final Duration loadTimeout;
    private final MeterRegistry meterRegistry;

    public PredictionOrchestrator(
        FeatureTransformer transformer,
        ModelCache modelCache,
        ModelCatalog catalog,
        InferenceProperties properties,
        MeterRegistry meterRegistry
    ) {
        this.transformer = transformer;
        this.modelCache = modelCache;
        this.catalog = catalog;
        this.loadTimeout = properties.getModelLoadTimeout();
        this.meterRegistry = meterRegistry;
    }

    public EnsembleResult predict(PassengerFeatures features) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            FeatureVector vector = transformer.transform(features);
            Map<String, ModelHandle> models = fetchModels();

            Map<String, ModelPrediction> perModel = new LinkedHashMap<>();
            models.forEach((key, model) -> perModel.put(key, ModelPrediction.of(model.predictProbability(vector))));
            EnsembleResult result = EnsembleResult.combine(perModel);
            log.debug("prediction probability={} label={} confidence_level={}",
                result.ensemble().probability(), result.ensemble().label(), result.ensemble().confidenceLevel().wire());
            return result;
        } catch (TransformException ex) {
            outcome = "transform_error";
            throw ex;
        } catch (ModelUnavailableException ex) {
            outcome = "model_unavailable";
            throw ex;
        } catch (RuntimeException ex) {
            outcome = "error";
            throw ex;
        } finally {
            meterRegistry.counter("inference_predictions_total", "outcome", outcome).increment();
            sample.stop(meterRegistry.timer("inference_prediction_latency"));
        }
    }

    private Map<String, ModelHandle> fetchModels() {
        Map<String, CompletableFuture<ModelHandle>> pending = new LinkedHashMap<>();
        for (String key : catalog.keys()) {
            pending.put(key, modelCache.getAsync(key));
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]));
        try {
            all.get(loadTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            String slowest = pending.entrySet().stream()
                .filter(entry -> !entry.getValue().isDone())
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);
            pending.values().forEach(future -> future.cancel(false));
            throw new ModelUnavailableException(slowest, "model load timed out: " + slowest, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            pending.values().forEach(future -> future.cancel(false));
            throw new ModelUnavailableException(null, "interrupted while waiting for models", ex);
        } catch (ExecutionException ex) {
            pending.forEach(modelCache::await);
            throw new ModelUnavailableException(null, "model load failed", ex.getCause());
        }

        Map<String, ModelHandle> models = new LinkedHashMap<>();
        pending.forEach((key, future) -> models.put(key, modelCache.await(key, future)));
        return models;
    }
}
