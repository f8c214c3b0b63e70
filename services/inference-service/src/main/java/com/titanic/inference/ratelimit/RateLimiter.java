package com.titanic.inference.ratelimit;

import java.time.Duration;

public interface RateLimiter {
    RateLimitDecision tryAcquire(String key, int limit, Duration window);
}
