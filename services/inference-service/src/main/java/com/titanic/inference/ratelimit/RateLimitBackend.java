package com.titanic.inference.ratelimit;

import java.util.Locale;

public enum RateLimitBackend {
    MEMORY,
    SHARED;

    public static RateLimitBackend from(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (RateLimitBackend backend : values()) {
            if (backend.name().equals(normalized)) {
                return backend;
            }
        }
        return null;
    }
}
