package com.titanic.inference.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Map;

public record CheckResult(String status, String message, Map<String, Object> details) {
    public static final String OK = "ok";
    public static final String DEGRADED = "degraded";

    public static CheckResult ok(String message, Map<String, Object> details) {
        return new CheckResult(OK, message, details);
    }

    public static CheckResult degraded(String message, Map<String, Object> details) {
        return new CheckResult(DEGRADED, message, details);
    }

    @JsonIgnore
    public boolean isOk() {
        return OK.equals(status);
    }
}
