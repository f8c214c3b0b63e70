package com.titanic.inference.health;

import java.util.Map;

/**
 * {@code checks} is null for the fast path.
 */
public record HealthReport(String status, ServingState state, Map<String, CheckResult> checks) {
}
