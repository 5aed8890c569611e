package com.cityhive.observability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health result for a single dependency.
 *
 * @param name      component name (e.g., "database")
 * @param status    health status of this component
 * @param message   optional human-readable message
 * @param latencyMs measured wall-clock duration of the check, null when not measured
 * @param metadata  optional machine-readable detail (e.g., {@code timeout_seconds}); values may be null
 */
public record ComponentHealth(
        String name,
        HealthStatus status,
        String message,
        Double latencyMs,
        Map<String, Object> metadata
) {

    /** Metadata key describing why a component is unhealthy. */
    public static final String REASON = "reason";

    public ComponentHealth {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Creates a healthy component result. */
    public static ComponentHealth healthy(String name, String message, double latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, message, latencyMs, null);
    }

    /** Creates an unhealthy component result. */
    public static ComponentHealth unhealthy(
            String name, String message, Double latencyMs, Map<String, Object> metadata) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs, metadata);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
