package com.titanic.inference.ratelimit;

import com.titanic.inference.config.ConfigurationException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

@Service
public class RateLimitService {
    private static final Logger log = LoggerFactory.getLogger(RateLimitService.class);

    private final RateLimiter rateLimiter;
    private final RateLimitProperties properties;

    @Autowired
    public RateLimitService(
        ObjectProvider<StringRedisTemplate> redisTemplate,
        RateLimitProperties properties,
        Clock clock
    ) {
        this(selectBackend(redisTemplate, properties, clock), properties);
    }

    public RateLimitService(RateLimiter rateLimiter, RateLimitProperties properties) {
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    public RateLimitDecision allow(String identity, String endpoint) {
        int limit = properties.limitFor(endpoint);
        return rateLimiter.tryAcquire(endpoint + ":" + identity, limit, properties.getWindow());
    }

    public RateLimitProperties getProperties() {
        return properties;
    }

    private static RateLimiter selectBackend(
        ObjectProvider<StringRedisTemplate> redisTemplate,
        RateLimitProperties properties,
        Clock clock
    ) {
        RateLimitBackend backend = RateLimitBackend.from(properties.getBackend());
        if (backend == null) {
            throw new ConfigurationException("unknown rate limit backend: " + properties.getBackend());
        }
        if (backend == RateLimitBackend.SHARED) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null) {
                throw new ConfigurationException("shared rate limit backend requires a Redis connection");
            }
            log.info("rate limiter backend=shared window={} max={}", properties.getWindow(), properties.getMaxRequests());
            return new RedisRateLimiter(template, clock);
        }
        log.info("rate limiter backend=memory window={} max={}", properties.getWindow(), properties.getMaxRequests());
        return new InMemoryRateLimiter(clock);
    }
}
