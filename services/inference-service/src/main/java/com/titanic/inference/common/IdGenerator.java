package com.titanic.inference.common;

import java.util.UUID;
import java.util.regex.Pattern;

public final class IdGenerator {
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9._:-]{1,128}$");

    private IdGenerator() {
    }

    public static String resolveRequestId(String headerValue) {
        String candidate = sanitize(headerValue);
        if (candidate != null) {
            return candidate;
        }
        return "req_" + UUID.randomUUID().toString().replace("-", "");
    }

    public static String resolveTraceId(String headerValue) {
        String candidate = sanitize(headerValue);
        if (candidate != null) {
            return candidate;
        }
        return "trace_" + UUID.randomUUID().toString().replace("-", "");
    }

    // Incoming ids are echoed into headers and logs, so anything unusual is replaced.
    private static String sanitize(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return null;
        }
        String trimmed = headerValue.trim();
        return SAFE_ID.matcher(trimmed).matches() ? trimmed : null;
    }
}
