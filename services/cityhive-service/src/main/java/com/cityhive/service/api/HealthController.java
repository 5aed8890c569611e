package com.cityhive.service.api;

import com.cityhive.observability.ComponentHealth;
import com.cityhive.observability.HealthAggregator;
import com.cityhive.observability.SystemHealth;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes for orchestrators and load balancers. Both answer 200 when
 * healthy and 503 otherwise.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private final HealthAggregator health;

    public HealthController(HealthAggregator health) {
        this.health = health;
    }

    /** Process is up. Never touches a dependency. */
    @GetMapping("/live")
    public ResponseEntity<HealthBody> live() {
        return toResponse(health.liveness());
    }

    /** Every dependency answered within its deadline. */
    @GetMapping("/ready")
    public ResponseEntity<HealthBody> ready() {
        return toResponse(health.readiness());
    }

    private static ResponseEntity<HealthBody> toResponse(SystemHealth result) {
        HttpStatus status = result.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(HealthBody.of(result));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record HealthBody(
            String status, String service, Instant timestamp, String version, List<ComponentBody> components) {

        static HealthBody of(SystemHealth health) {
            return new HealthBody(
                    lowerCase(health.status().name()),
                    health.serviceName(),
                    health.timestamp(),
                    health.version(),
                    health.components() == null
                            ? null
                            : health.components().stream().map(ComponentBody::of).toList());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ComponentBody(
            String name, String status, String message, Double responseTimeMs, Map<String, Object> metadata) {

        static ComponentBody of(ComponentHealth component) {
            return new ComponentBody(
                    component.name(),
                    lowerCase(component.status().name()),
                    component.message(),
                    component.latencyMs(),
                    component.metadata());
        }
    }

    private static String lowerCase(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
