package com.cityhive.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a {@link DependencyCheck} against a deadline and classifies the outcome.
 * <p>
 * The check runs on the supplied executor and races a timer ({@link CompletableFuture#orTimeout}).
 * Whichever finishes first decides the result. When the timer wins, the running check is
 * cancelled with interruption and never awaited; a late completion is ignored. Failures never surface as
 * exceptions; they are reported as {@link HealthStatus#UNHEALTHY} results:
 * <ul>
 *   <li>in time, no error: HEALTHY, "Connected successfully"</li>
 *   <li>deadline passed: UNHEALTHY, message carries the timeout, metadata {@code timeout_seconds}</li>
 *   <li>error: UNHEALTHY, message carries the exception type only, metadata {@code error}</li>
 *   <li>cancelled: UNHEALTHY, "Health check cancelled"</li>
 * </ul>
 * Latency is measured for every outcome.
 */
public final class HealthProbe implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthProbe.class);

    public static final String CONNECTED = "Connected successfully";
    public static final String CANCELLED = "Health check cancelled";
    public static final String REASON_TIMEOUT = "timeout";
    public static final String REASON_ERROR = "error";
    public static final String REASON_CANCELLED = "cancelled";
    public static final String TIMEOUT_SECONDS = "timeout_seconds";
    public static final String ERROR = "error";

    private final ExecutorService executor;

    /**
     * @param executor runs the dependency checks; must not be shared with callers that block on
     *                 probe results, or a full pool can delay the checks past their deadline
     */
    public HealthProbe(ExecutorService executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        this.executor = executor;
    }

    /**
     * Starts a probe. The returned future always completes normally with a classified result,
     * no later than {@code timeout} plus scheduling overhead. Completing or cancelling it before
     * the probe resolves cancels the running check at once.
     *
     * @param component component name reported in the result
     * @param check     the round trip to perform
     * @param timeout   deadline for the round trip
     */
    public CompletableFuture<ComponentHealth> probe(String component, DependencyCheck check, Duration timeout) {
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        long startNanos = System.nanoTime();
        CompletableFuture<Void> race = new CompletableFuture<>();
        Future<?> running = executor.submit(() -> {
            try {
                check.execute();
                race.complete(null);
            } catch (Throwable t) {
                race.completeExceptionally(t);
            }
        });
        CompletableFuture<ComponentHealth> result = race
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((ignored, failure) -> {
                    if (failure != null) {
                        running.cancel(true);
                    }
                    return classify(component, timeout, startNanos, failure);
                });
        // A caller that settles the result first has given up: stop the race and the check.
        result.whenComplete((health, failure) -> {
            if (!race.isDone()) {
                race.completeExceptionally(new CancellationException("probe abandoned by caller"));
                running.cancel(true);
            }
        });
        return result;
    }

    /**
     * Result used when the caller gives up on a probe before it resolves.
     *
     * @param component  component name
     * @param startNanos {@link System#nanoTime()} at the moment probing started
     */
    public static ComponentHealth cancelled(String component, long startNanos) {
        return ComponentHealth.unhealthy(
                component, CANCELLED, elapsedMs(startNanos), Map.of(ComponentHealth.REASON, REASON_CANCELLED));
    }

    /**
     * Stops the executor and interrupts checks still running.
     */
    @Override
    public void close() {
        executor.shutdownNow();
    }

    private ComponentHealth classify(String component, Duration timeout, long startNanos, Throwable failure) {
        double latencyMs = elapsedMs(startNanos);
        if (failure == null) {
            log.info("Health check passed: component={}, latencyMs={}", component, latencyMs);
            return ComponentHealth.healthy(component, CONNECTED, latencyMs);
        }

        Throwable cause = unwrap(failure);
        if (cause instanceof TimeoutException) {
            double timeoutSeconds = timeout.toMillis() / 1000.0;
            log.warn("Health check timed out: component={}, timeoutSeconds={}, latencyMs={}",
                    component, timeoutSeconds, latencyMs);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(TIMEOUT_SECONDS, timeoutSeconds);
            metadata.put(ComponentHealth.REASON, REASON_TIMEOUT);
            return ComponentHealth.unhealthy(
                    component, "Connection timed out after " + timeoutSeconds + "s", latencyMs, metadata);
        }
        if (cause instanceof CancellationException) {
            return cancelled(component, startNanos);
        }

        log.warn("Health check failed: component={}, errorType={}, latencyMs={}",
                component, cause.getClass().getSimpleName(), latencyMs, cause);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ERROR, cause.getMessage());
        metadata.put(ComponentHealth.REASON, REASON_ERROR);
        return ComponentHealth.unhealthy(
                component, "Connection failed: " + cause.getClass().getSimpleName(), latencyMs, metadata);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
