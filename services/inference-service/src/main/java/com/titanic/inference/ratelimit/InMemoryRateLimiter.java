package com.titanic.inference.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryRateLimiter implements RateLimiter {
    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final AtomicLong lastPruneMs = new AtomicLong();
    private final Clock clock;

    public InMemoryRateLimiter(Clock clock) {
        this.clock = clock;
        this.lastPruneMs.set(clock.millis());
    }

    @Override
    public RateLimitDecision tryAcquire(String key, int limit, Duration window) {
        long windowMs = Math.max(window.toMillis(), 1L);
        long nowMs = clock.millis();
        long windowId = Math.floorDiv(nowMs, windowMs);
        pruneIfDue(nowMs, windowMs, windowId);

        while (true) {
            Counter counter = counters.computeIfAbsent(key, k -> new Counter(windowId));
            synchronized (counter) {
                if (counter.removed) {
                    continue;
                }
                if (counter.windowId != windowId) {
                    counter.windowId = windowId;
                    counter.count = 0;
                }
                if (counter.count >= limit) {
                    long resetAtMs = (windowId + 1) * windowMs;
                    return RateLimitDecision.reject(limit, Duration.ofMillis(resetAtMs - nowMs));
                }
                counter.count += 1;
                return RateLimitDecision.permit(limit, limit - counter.count);
            }
        }
    }

    int trackedKeys() {
        return counters.size();
    }

    private void pruneIfDue(long nowMs, long windowMs, long windowId) {
        long last = lastPruneMs.get();
        if (nowMs - last < windowMs || !lastPruneMs.compareAndSet(last, nowMs)) {
            return;
        }
        counters.forEach((key, counter) -> {
            synchronized (counter) {
                if (counter.windowId < windowId) {
                    counter.removed = true;
                    counters.remove(key, counter);
                }
            }
        });
    }

    private static class Counter {
        private long windowId;
        private int count;
        private boolean removed;

        private Counter(long windowId) {
            this.windowId = windowId;
        }
    }
}
