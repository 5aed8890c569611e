package com.cityhive.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Registry of {@link DependencyCheck}s that produces liveness and readiness results.
 * <p>
 * Liveness never touches a dependency. Readiness probes every registered dependency
 * concurrently through {@link HealthProbe}, each with the same deadline, and reports
 * HEALTHY only when every component is HEALTHY. Results are built fresh on every call.
 * <p>
 * Components are reported in name order.
 */
public final class HealthAggregator {

    private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

    /** Default deadline for an individual dependency check. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public static final String PROBE_TIMER = "cityhive.health.probe";

    private final Map<String, DependencyCheck> checks = new ConcurrentSkipListMap<>();
    private final HealthProbe probe;
    private final String serviceName;
    private final String version;
    private final Duration timeout;
    private final MetricFactory metrics;
    private final Clock clock;

    /**
     * @param probe       runs individual checks against their deadline
     * @param serviceName logical service name reported in every result
     * @param version     service version, nullable
     * @param timeout     deadline applied to each dependency check
     * @param metrics     records probe latency per component and status
     * @param clock       source of result timestamps
     */
    public HealthAggregator(
            HealthProbe probe,
            String serviceName,
            String version,
            Duration timeout,
            MetricFactory metrics,
            Clock clock) {
        if (probe == null || metrics == null || clock == null) {
            throw new IllegalArgumentException("probe, metrics and clock must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.probe = probe;
        this.serviceName = serviceName;
        this.version = version;
        this.timeout = timeout;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Registers a dependency under the given component name.
     * Replaces any existing check for the same name.
     *
     * @param name  component name (e.g., "database")
     * @param check the round trip to perform
     */
    public void register(String name, DependencyCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    /**
     * Removes a dependency by component name.
     *
     * @return true if a check was removed
     */
    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    public int size() {
        return checks.size();
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Process-level health. Performs no I/O and is always HEALTHY.
     */
    public SystemHealth liveness() {
        return SystemHealth.alive(serviceName, version, clock.instant());
    }

    /**
     * Probes every registered dependency concurrently and aggregates the results.
     * <p>
     * If the calling thread is interrupted while waiting, the interrupt flag is restored and
     * components that have not resolved yet are reported as cancelled.
     *
     * @throws IllegalStateException if classifying a probe outcome itself failed
     */
    public SystemHealth readiness() {
        long startNanos = System.nanoTime();
        Map<String, CompletableFuture<ComponentHealth>> pending = new LinkedHashMap<>();
        for (Map.Entry<String, DependencyCheck> entry : checks.entrySet()) {
            pending.put(entry.getKey(), probe.probe(entry.getKey(), entry.getValue(), timeout));
        }

        try {
            CompletableFuture.allOf(pending.values().toArray(new CompletableFuture<?>[0])).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Readiness check interrupted, reporting unresolved components as cancelled");
            pending.forEach((name, future) -> future.complete(HealthProbe.cancelled(name, startNanos)));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Health probe failed unexpectedly", e.getCause());
        }

        List<ComponentHealth> components = new ArrayList<>(pending.size());
        for (CompletableFuture<ComponentHealth> future : pending.values()) {
            ComponentHealth component = future.join();
            record(component);
            components.add(component);
        }

        SystemHealth health = SystemHealth.ofComponents(serviceName, version, clock.instant(), components);
        if (!health.isHealthy()) {
            log.warn("Readiness check failed: unhealthy={}", components.stream()
                    .filter(c -> !c.isHealthy())
                    .map(ComponentHealth::name)
                    .toList());
        }
        return health;
    }

    private void record(ComponentHealth component) {
        if (component.latencyMs() == null) {
            return;
        }
        metrics.timer(PROBE_TIMER, "Duration of dependency health checks",
                        "component", component.name(),
                        "status", component.status().name().toLowerCase(Locale.ROOT))
                .record((long) (component.latencyMs() * 1_000_000), TimeUnit.NANOSECONDS);
    }
}
