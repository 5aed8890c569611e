package com.cityhive.observability;

import java.time.Instant;
import java.util.List;

/**
 * Overall system health.
 * <p>
 * Liveness results never carry components; readiness results always do. When components are
 * present the status is HEALTHY iff every component is HEALTHY.
 *
 * @param status      overall status
 * @param timestamp   when the check was performed
 * @param serviceName logical service name
 * @param version     service version (nullable)
 * @param components  per-dependency results, null for liveness
 */
public record SystemHealth(
        HealthStatus status,
        Instant timestamp,
        String serviceName,
        String version,
        List<ComponentHealth> components
) {

    public SystemHealth {
        if (status == null || timestamp == null) {
            throw new IllegalArgumentException("status and timestamp must not be null");
        }
        if (components != null) {
            components = List.copyOf(components);
            if (status != worstOf(components)) {
                throw new IllegalArgumentException("status " + status + " contradicts components");
            }
        } else if (status != HealthStatus.HEALTHY) {
            throw new IllegalArgumentException("a result without components is always HEALTHY");
        }
    }

    /** Liveness result: healthy, without components. */
    public static SystemHealth alive(String serviceName, String version, Instant timestamp) {
        return new SystemHealth(HealthStatus.HEALTHY, timestamp, serviceName, version, null);
    }

    /** Readiness result whose status is derived from the components. */
    public static SystemHealth ofComponents(
            String serviceName, String version, Instant timestamp, List<ComponentHealth> components) {
        return new SystemHealth(worstOf(components), timestamp, serviceName, version, components);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }

    private static HealthStatus worstOf(List<ComponentHealth> components) {
        return components.stream().allMatch(ComponentHealth::isHealthy)
                ? HealthStatus.HEALTHY
                : HealthStatus.UNHEALTHY;
    }
}
