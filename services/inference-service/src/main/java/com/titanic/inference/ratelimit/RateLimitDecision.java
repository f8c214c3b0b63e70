package com.titanic.inference.ratelimit;

import java.time.Duration;

public record RateLimitDecision(boolean permitted, int limit, int remaining, Duration retryAfter) {
    public static RateLimitDecision permit(int limit, int remaining) {
        return new RateLimitDecision(true, limit, Math.max(0, remaining), null);
    }

    public static RateLimitDecision reject(int limit, Duration retryAfter) {
        return new RateLimitDecision(false, limit, 0, retryAfter);
    }

    public long retryAfterSeconds() {
        if (retryAfter == null) {
            return 0L;
        }
        long millis = Math.max(0L, retryAfter.toMillis());
        return Math.max(1L, (millis + 999L) / 1000L);
    }
}
