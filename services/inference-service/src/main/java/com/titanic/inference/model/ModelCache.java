package com.titanic.inference.model;

import com.titanic.inference.config.InferenceProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Lazily loads models, one load per key at a time. Every caller racing on a key
 * shares the same future, so they all observe one outcome. A failed load is
 * removed before its future fails, which lets the next call start a new attempt.
 * A load still running after the load timeout is failed the same way; its late
 * result is discarded.
 */
@Component
public class ModelCache {
    private static final Logger log = LoggerFactory.getLogger(ModelCache.class);

    private final ModelLoader loader;
    private final Executor executor;
    private final Duration loadTimeout;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final ConcurrentMap<String, CompletableFuture<ModelHandle>> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LoadFailure> failures = new ConcurrentHashMap<>();

    @Autowired
    public ModelCache(
        ModelLoader loader,
        @Qualifier("modelLoadExecutor") Executor executor,
        InferenceProperties properties,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this(loader, executor, properties.getModelLoadTimeout(), meterRegistry, clock);
    }

    public ModelCache(ModelLoader loader, Executor executor, Duration loadTimeout, MeterRegistry meterRegistry, Clock clock) {
        this.loader = loader;
        this.executor = executor;
        this.loadTimeout = loadTimeout;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public ModelHandle get(String key) {
        CompletableFuture<ModelHandle> existing = entries.get(key);
        if (existing != null && existing.isDone() && !existing.isCompletedExceptionally()) {
            return existing.join();
        }
        return await(key, getAsync(key));
    }

    /**
     * Returns a copy of the shared load future. Cancelling or timing out on the
     * copy leaves the shared load running for other callers.
     */
    public CompletableFuture<ModelHandle> getAsync(String key) {
        return entryFor(key).copy();
    }

    public ModelHandle await(String key, CompletableFuture<ModelHandle> future) {
        try {
            return future.get(loadTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(false);
            throw new ModelUnavailableException(key, "model load timed out: " + key, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ModelUnavailableException(key, "interrupted while waiting for model: " + key, ex);
        } catch (ExecutionException ex) {
            throw unavailable(key, ex.getCause());
        }
    }

    public ModelStatus status(String key) {
        CompletableFuture<ModelHandle> future = entries.get(key);
        if (future == null) {
            return failures.containsKey(key) ? ModelStatus.FAILED : ModelStatus.NOT_LOADED;
        }
        return future.isDone() && !future.isCompletedExceptionally() ? ModelStatus.LOADED : ModelStatus.LOADING;
    }

    public Optional<LoadFailure> lastFailure(String key) {
        return Optional.ofNullable(failures.get(key));
    }

    private CompletableFuture<ModelHandle> entryFor(String key) {
        CompletableFuture<ModelHandle> existing = entries.get(key);
        if (existing != null) {
            return existing;
        }
        CompletableFuture<ModelHandle> created = new CompletableFuture<>();
        existing = entries.putIfAbsent(key, created);
        if (existing != null) {
            return existing;
        }
        log.info("model load started model={}", key);
        try {
            executor.execute(() -> load(key, created));
        } catch (RejectedExecutionException ex) {
            fail(key, created, ex);
            return created;
        }
        CompletableFuture.delayedExecutor(loadTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .execute(() -> expire(key, created));
        return created;
    }

    private void expire(String key, CompletableFuture<ModelHandle> future) {
        if (future.isDone()) {
            return;
        }
        log.warn("model load exceeded timeout model={} timeout_ms={}", key, loadTimeout.toMillis());
        fail(key, future, new ModelUnavailableException(key, "model load timed out: " + key));
    }

    private void load(String key, CompletableFuture<ModelHandle> future) {
        ModelHandle handle;
        try {
            handle = loader.load(key);
            if (handle == null) {
                throw new ModelUnavailableException(key, "loader returned no model: " + key);
            }
        } catch (Throwable ex) {
            fail(key, future, ex);
            return;
        }
        synchronized (future) {
            if (future.isDone()) {
                log.warn("model load finished after timeout, result discarded model={}", key);
                return;
            }
            failures.remove(key);
            meterRegistry.counter("inference_model_load_total", "model", key, "outcome", "success").increment();
            future.complete(handle);
        }
    }

    private void fail(String key, CompletableFuture<ModelHandle> future, Throwable cause) {
        synchronized (future) {
            if (future.isDone()) {
                log.warn("model load failed after timeout model={} error={}", key, cause.getMessage());
                return;
            }
            entries.remove(key, future);
            failures.put(key, new LoadFailure(String.valueOf(cause.getMessage()), clock.instant()));
            meterRegistry.counter("inference_model_load_total", "model", key, "outcome", "failure").increment();
            log.error("model load failed model={} error={}", key, cause.getMessage(), cause);
            future.completeExceptionally(unavailable(key, cause));
        }
    }

    private static ModelUnavailableException unavailable(String key, Throwable cause) {
        if (cause instanceof ModelUnavailableException unavailable) {
            return unavailable;
        }
        return new ModelUnavailableException(key, "model unavailable: " + key, cause);
    }

    public record LoadFailure(String message, Instant failedAt) {
    }
}
