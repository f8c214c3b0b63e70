package com.titanic.inference.ratelimit;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "inference.rate-limit")
public class RateLimitProperties {
    private boolean enabled = true;
    private String backend = "memory";
    private Duration window = Duration.ofSeconds(60);
    private int maxRequests = 10;
    private Map<String, Integer> endpointLimits = new LinkedHashMap<>();

    public int limitFor(String endpoint) {
        Integer override = endpointLimits.get(endpoint);
        return override != null ? override : maxRequests;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
        this.maxRequests = maxRequests;
    }

    public Map<String, Integer> getEndpointLimits() {
        return endpointLimits;
    }

    public void setEndpointLimits(Map<String, Integer> endpointLimits) {
        this.endpointLimits = endpointLimits;
    }
}
