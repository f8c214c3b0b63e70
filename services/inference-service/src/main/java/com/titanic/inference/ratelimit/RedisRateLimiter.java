package com.titanic.inference.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

public class RedisRateLimiter implements RateLimiter {
    // The counter and its expiry are created together, so a window key never outlives its window.
    static final DefaultRedisScript<Long> WINDOW_INCREMENT = new DefaultRedisScript<>(
        "local count = redis.call('INCR', KEYS[1])\n"
            + "if count == 1 then\n"
            + "  redis.call('PEXPIRE', KEYS[1], ARGV[1])\n"
            + "end\n"
            + "return count",
        Long.class
    );

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    @Override
    public RateLimitDecision tryAcquire(String key, int limit, Duration window) {
        long windowMs = Math.max(window.toMillis(), 1L);
        long nowMs = clock.millis();
        long windowId = Math.floorDiv(nowMs, windowMs);
        String redisKey = "rl:" + key + ":" + windowId;

        Long count;
        try {
            count = redisTemplate.execute(WINDOW_INCREMENT, Collections.singletonList(redisKey), String.valueOf(windowMs));
        } catch (DataAccessException ex) {
            throw new RateLimitUnavailableException("rate limit store unavailable", ex);
        }
        if (count == null) {
            throw new RateLimitUnavailableException("rate limit store returned no count", null);
        }
        if (count > limit) {
            long resetAtMs = (windowId + 1) * windowMs;
            return RateLimitDecision.reject(limit, Duration.ofMillis(resetAtMs - nowMs));
        }
        return RateLimitDecision.permit(limit, (int) (limit - count));
    }
}
